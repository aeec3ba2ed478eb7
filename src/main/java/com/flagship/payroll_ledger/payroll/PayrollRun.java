package com.flagship.payroll_ledger.payroll;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Payroll run domain object: one pay period's worth of finalized payroll lines.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - State changes are immutable (create new PayrollRun with new status)
 * - A closed run may or may not reference a journal (empty runs post nothing)
 */
@Value
public class PayrollRun {
    UUID id;
    String name;
    YearMonth period;
    PayrollRunStatus status;
    UUID journalId;
    Instant closedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new PayrollRun in OPEN status.
     */
    public static PayrollRun create(UUID id, String name, YearMonth period) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Payroll run name is required");
        }
        if (period == null) {
            throw new IllegalArgumentException("Payroll run period is required");
        }
        Instant now = Instant.now();
        return new PayrollRun(id, name, period, PayrollRunStatus.OPEN, null, null, now, now);
    }

    /**
     * Transitions the run to CLOSING. Only valid from OPEN.
     *
     * @throws IllegalStateException if transition is not allowed
     */
    public PayrollRun startClosing() {
        if (this.status != PayrollRunStatus.OPEN) {
            throw new IllegalStateException(
                String.format("Cannot close payroll run in %s status. Only OPEN runs can be closed.", this.status));
        }
        return new PayrollRun(id, name, period, PayrollRunStatus.CLOSING, null, null, createdAt, Instant.now());
    }

    /**
     * Transitions the run to CLOSED, recording the posted journal.
     *
     * @param postedJournalId the run's journal, or null when the run posted nothing
     * @throws IllegalStateException if the run is already CLOSED
     */
    public PayrollRun close(UUID postedJournalId) {
        if (this.status == PayrollRunStatus.CLOSED) {
            throw new IllegalStateException("Payroll run " + id + " is already CLOSED");
        }
        Instant now = Instant.now();
        return new PayrollRun(id, name, period, PayrollRunStatus.CLOSED, postedJournalId, now, createdAt, now);
    }

    public boolean isClosed() {
        return status == PayrollRunStatus.CLOSED;
    }

    public boolean isOpen() {
        return status == PayrollRunStatus.OPEN;
    }

    public LocalDate getPeriodStart() {
        return period.atDay(1);
    }

    public LocalDate getPeriodEnd() {
        return period.atEndOfMonth();
    }
}
