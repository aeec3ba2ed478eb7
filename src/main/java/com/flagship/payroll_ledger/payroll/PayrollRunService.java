package com.flagship.payroll_ledger.payroll;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * Records the already-computed payroll figures that a run close posts.
 *
 * Figures are frozen once the run leaves OPEN: lines cannot be added to it, and pay
 * components cannot be recorded for an employee in a period that has been closed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollRunService {

    private final PayrollRunPersistenceService persistenceService;

    @Transactional
    public PayrollRun createRun(String name, YearMonth period) {
        PayrollRun run = PayrollRun.create(UUID.randomUUID(), name, period);
        PayrollRun saved = persistenceService.save(run).toDomain();
        log.info("Created payroll run {} ({}) for period {}", saved.getId(), name, period);
        return saved;
    }

    @Transactional(readOnly = true)
    public PayrollRun getRun(UUID runId) {
        return persistenceService.findById(runId)
            .orElseThrow(() -> new IllegalArgumentException("Payroll run not found: " + runId));
    }

    @Transactional(readOnly = true)
    public List<PayrollRunLine> getLines(UUID runId) {
        return persistenceService.findLines(runId);
    }

    /**
     * Adds one employee's figures to an OPEN run.
     *
     * @throws IllegalStateException if the run is not OPEN
     * @throws IllegalArgumentException if the employee is already on a run for the same period
     */
    @Transactional
    public PayrollRunLine addLine(UUID runId, String employeeId, String employeeName, BigDecimal netPay,
                                  BigDecimal incomeTax, BigDecimal annualPension, BigDecimal annualHousingFund,
                                  BigDecimal annualHealth) {
        PayrollRun run = persistenceService.findByIdForUpdate(runId)
            .map(PayrollRunEntity::toDomain)
            .orElseThrow(() -> new IllegalArgumentException("Payroll run not found: " + runId));
        if (!run.isOpen()) {
            throw new IllegalStateException(
                String.format("Cannot add lines to payroll run %s in %s status", runId, run.getStatus()));
        }
        if (persistenceService.hasLineInPeriod(employeeId, run.getPeriod())) {
            throw alreadyPaid(employeeId, run.getPeriod(), null);
        }
        PayrollRunLine line = PayrollRunLine.create(runId, employeeId, employeeName, netPay, incomeTax,
            annualPension, annualHousingFund, annualHealth);
        PayrollRunLine saved;
        try {
            saved = persistenceService.saveLine(line, run.getPeriod());
        } catch (DataIntegrityViolationException e) {
            // Lost a race with another run of the same period
            throw alreadyPaid(employeeId, run.getPeriod(), e);
        }
        log.debug("Added line for employee {} to payroll run {}", employeeId, runId);
        return saved;
    }

    /**
     * Records a pay component for an employee.
     *
     * The runs of the component's period are locked first, so a close in progress either
     * finishes before the check (and the component is rejected) or reads the component.
     *
     * @throws IllegalStateException if the employee's run for that period is already closed
     */
    @Transactional
    public PayComponent recordComponent(String employeeId, PayComponentType componentType, BigDecimal amount,
                                        LocalDate effectiveDate, String description) {
        PayComponent component = PayComponent.create(employeeId, componentType, amount, effectiveDate, description);
        persistenceService.lockRunsInPeriod(component.getPeriod());
        if (persistenceService.isEmployeeInClosedRun(employeeId, component.getPeriod())) {
            throw new IllegalStateException(
                String.format("Payroll for employee %s in %s is already closed", employeeId, component.getPeriod()));
        }
        PayComponent saved = persistenceService.saveComponent(component);
        log.debug("Recorded {} of {} for employee {} effective {}", componentType, amount, employeeId, effectiveDate);
        return saved;
    }

    private static IllegalArgumentException alreadyPaid(String employeeId, YearMonth period, Throwable cause) {
        return new IllegalArgumentException(
            String.format("Employee %s is already on a payroll run for %s", employeeId, period), cause);
    }
}
