package com.flagship.payroll_ledger.payroll;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * JPA Entity for a payroll run line. Lines are immutable once written.
 *
 * The run's period is copied onto the line so that the database can hold an employee
 * to one line per period across all runs.
 */
@Entity
@Table(
    name = "payroll_run_lines",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_payroll_run_lines_employee", columnNames = {"payroll_run_id", "employee_id"}),
        @UniqueConstraint(name = "uq_payroll_run_lines_employee_period", columnNames = {"employee_id", "period_start"})
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayrollRunLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payroll_run_id", nullable = false, updatable = false)
    private UUID payrollRunId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDate periodStart;

    @Column(name = "employee_id", nullable = false, updatable = false, length = 50)
    private String employeeId;

    @Column(name = "employee_name", updatable = false)
    private String employeeName;

    @Column(name = "net_pay", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal netPay;

    @Column(name = "income_tax", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal incomeTax;

    @Column(name = "annual_pension", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal annualPension;

    @Column(name = "annual_housing_fund", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal annualHousingFund;

    @Column(name = "annual_health", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal annualHealth;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static PayrollRunLineEntity fromDomain(PayrollRunLine line, YearMonth period) {
        return new PayrollRunLineEntity(
            line.getId(),
            line.getPayrollRunId(),
            period.atDay(1),
            line.getEmployeeId(),
            line.getEmployeeName(),
            line.getNetPay(),
            line.getIncomeTax(),
            line.getAnnualPension(),
            line.getAnnualHousingFund(),
            line.getAnnualHealth(),
            null
        );
    }

    public PayrollRunLine toDomain() {
        return new PayrollRunLine(
            id,
            payrollRunId,
            employeeId,
            employeeName,
            netPay,
            incomeTax,
            annualPension,
            annualHousingFund,
            annualHealth
        );
    }
}
