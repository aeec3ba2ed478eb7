package com.flagship.payroll_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger postings.
 *
 * Metrics exposed:
 * - ledger.journals.created: journals persisted, tagged by status (DRAFT/POSTED)
 * - ledger.journals.rejected: journals refused before commit, tagged by reason
 * - ledger.journals.reversed: reversal journals posted
 * - payroll.close: close attempts, tagged by outcome
 * - payroll.close.duration: time taken to close a run
 * - ledger.notifications: journal-posted notifications, tagged by result
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter journalsReversed;
    private final Timer closeTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.journalsReversed = Counter.builder("ledger.journals.reversed")
                .description("Number of reversal journals posted")
                .register(registry);

        this.closeTimer = Timer.builder("payroll.close.duration")
                .description("Time taken to close a payroll run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Journal Metrics ====================

    public void recordJournalCreated(String status) {
        registry.counter("ledger.journals.created", "status", sanitizeTag(status)).increment();
    }

    /**
     * Records a journal that was refused, e.g. unbalanced or blocked by the balance guard.
     */
    public void recordJournalRejected(String reason) {
        registry.counter("ledger.journals.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void incrementJournalsReversed() {
        journalsReversed.increment();
    }

    // ==================== Payroll Close Metrics ====================

    /**
     * Records the outcome of a close attempt: posted, already_closed, no_journal or error.
     */
    public void recordCloseOutcome(String outcome) {
        registry.counter("payroll.close", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordCloseDuration(Duration duration) {
        closeTimer.record(duration);
    }

    // ==================== Notification Metrics ====================

    public void recordNotificationSent(String eventKind) {
        registry.counter("ledger.notifications",
                "event_kind", sanitizeTag(eventKind),
                "result", "sent"
        ).increment();
    }

    public void recordNotificationFailure(String eventKind) {
        registry.counter("ledger.notifications",
                "event_kind", sanitizeTag(eventKind),
                "result", "failed"
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
