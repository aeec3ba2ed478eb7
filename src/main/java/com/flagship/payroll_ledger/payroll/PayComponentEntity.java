package com.flagship.payroll_ledger.payroll;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "pay_components",
    indexes = {
        @Index(name = "idx_pay_components_employee_date", columnList = "employee_id, effective_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayComponentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "employee_id", nullable = false, updatable = false, length = 50)
    private String employeeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "component_type", nullable = false, updatable = false)
    private PayComponentType componentType;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "effective_date", nullable = false, updatable = false)
    private LocalDate effectiveDate;

    @Column(updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static PayComponentEntity fromDomain(PayComponent component) {
        return new PayComponentEntity(
            component.getId(),
            component.getEmployeeId(),
            component.getComponentType(),
            component.getAmount(),
            component.getEffectiveDate(),
            component.getDescription(),
            null
        );
    }

    public PayComponent toDomain() {
        return new PayComponent(id, employeeId, componentType, amount, effectiveDate, description);
    }
}
