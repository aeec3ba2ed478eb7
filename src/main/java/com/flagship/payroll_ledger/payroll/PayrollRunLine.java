package com.flagship.payroll_ledger.payroll;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * One employee's finalized figures in a payroll run.
 *
 * Net pay and income tax are per period. Pension, housing fund and health are annual
 * contributions, scaled down to the period when the run is posted.
 */
@Value
public class PayrollRunLine {
    UUID id;
    UUID payrollRunId;
    String employeeId;
    String employeeName;
    BigDecimal netPay;
    BigDecimal incomeTax;
    BigDecimal annualPension;
    BigDecimal annualHousingFund;
    BigDecimal annualHealth;

    public static PayrollRunLine create(UUID payrollRunId, String employeeId, String employeeName,
                                        BigDecimal netPay, BigDecimal incomeTax, BigDecimal annualPension,
                                        BigDecimal annualHousingFund, BigDecimal annualHealth) {
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("Employee id is required");
        }
        return new PayrollRunLine(
            UUID.randomUUID(),
            payrollRunId,
            employeeId,
            employeeName,
            money("netPay", netPay),
            money("incomeTax", incomeTax),
            money("annualPension", annualPension),
            money("annualHousingFund", annualHousingFund),
            money("annualHealth", annualHealth)
        );
    }

    private static BigDecimal money(String field, BigDecimal value) {
        BigDecimal amount = value != null ? value.setScale(2, RoundingMode.HALF_UP) : BigDecimal.ZERO.setScale(2);
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
        return amount;
    }
}
