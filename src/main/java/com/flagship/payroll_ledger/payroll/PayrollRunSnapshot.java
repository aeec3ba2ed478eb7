package com.flagship.payroll_ledger.payroll;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A payroll run as read at close time: its lines and the pay components effective in its period.
 */
@Value
public class PayrollRunSnapshot {
    PayrollRun run;
    List<PayrollRunLine> lines;
    List<PayComponent> components;

    public PayrollRunSnapshot(PayrollRun run, List<PayrollRunLine> lines, List<PayComponent> components) {
        this.run = run;
        this.lines = List.copyOf(lines);
        this.components = List.copyOf(components);
    }

    /**
     * Sum of one employee's components of the given type within the run's period.
     */
    public BigDecimal componentTotal(String employeeId, PayComponentType componentType) {
        return components.stream()
            .filter(component -> component.getEmployeeId().equals(employeeId))
            .filter(component -> component.getComponentType() == componentType)
            .filter(component -> component.getPeriod().equals(run.getPeriod()))
            .map(PayComponent::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
