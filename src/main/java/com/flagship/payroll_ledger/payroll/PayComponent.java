package com.flagship.payroll_ledger.payroll;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * An allowance, deduction or advance recovery recorded against an employee.
 * A payroll run picks up the components effective within its period.
 */
@Value
public class PayComponent {
    UUID id;
    String employeeId;
    PayComponentType componentType;
    BigDecimal amount;
    LocalDate effectiveDate;
    String description;

    public static PayComponent create(String employeeId, PayComponentType componentType, BigDecimal amount,
                                      LocalDate effectiveDate, String description) {
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("Employee id is required");
        }
        if (componentType == null) {
            throw new IllegalArgumentException("Component type is required");
        }
        if (effectiveDate == null) {
            throw new IllegalArgumentException("Effective date is required");
        }
        if (amount == null || amount.setScale(2, RoundingMode.HALF_UP).signum() <= 0) {
            throw new IllegalArgumentException("Component amount must be positive: " + amount);
        }
        return new PayComponent(UUID.randomUUID(), employeeId, componentType,
            amount.setScale(2, RoundingMode.HALF_UP), effectiveDate, description);
    }

    public YearMonth getPeriod() {
        return YearMonth.from(effectiveDate);
    }
}
