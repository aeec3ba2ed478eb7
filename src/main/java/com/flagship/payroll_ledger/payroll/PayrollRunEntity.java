package com.flagship.payroll_ledger.payroll;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * JPA Entity for payroll run persistence.
 *
 * - No @Setter: status changes go through the PayrollRun domain object
 * - The period is stored as the first day of its month
 * - The journal id is written once, when the run closes
 */
@Entity
@Table(
    name = "payroll_runs",
    indexes = {
        @Index(name = "idx_payroll_runs_period_status", columnList = "period_start, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayrollRunEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDate periodStart;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PayrollRunStatus status;

    @Column(name = "journal_id")
    private UUID journalId;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PayrollRunEntity fromDomain(PayrollRun run) {
        return new PayrollRunEntity(
            run.getId(),
            run.getName(),
            run.getPeriodStart(),
            run.getStatus(),
            null, // journalId - set when the run closes
            run.getClosedAt(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public PayrollRun toDomain() {
        return new PayrollRun(
            id,
            name,
            YearMonth.from(periodStart),
            status,
            journalId,
            closedAt,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable state (status, close time) from the domain object.
     * The journal id is set separately through {@link #setJournalId(UUID)}.
     */
    void updateFromDomain(PayrollRun run) {
        this.status = run.getStatus();
        this.closedAt = run.getClosedAt();
    }

    /**
     * Records the journal posted for this run. Can only be called once, on a CLOSED run.
     */
    void setJournalId(UUID journalId) {
        if (this.journalId != null) {
            throw new IllegalStateException(
                "Journal already recorded for payroll run " + this.id + ". Cannot post a run twice.");
        }
        if (this.status != PayrollRunStatus.CLOSED) {
            throw new IllegalStateException(
                "Cannot record journal for payroll run in " + this.status + " status. Run must be CLOSED.");
        }
        this.journalId = journalId;
    }

    boolean isClosed() {
        return status == PayrollRunStatus.CLOSED;
    }
}
