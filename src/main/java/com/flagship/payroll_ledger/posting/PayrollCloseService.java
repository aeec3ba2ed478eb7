package com.flagship.payroll_ledger.posting;

import com.flagship.payroll_ledger.ledger.Journal;
import com.flagship.payroll_ledger.ledger.JournalEntryRequest;
import com.flagship.payroll_ledger.ledger.JournalFactory;
import com.flagship.payroll_ledger.ledger.JournalRequest;
import com.flagship.payroll_ledger.ledger.LedgerStore;
import com.flagship.payroll_ledger.ledger.SourceReference;
import com.flagship.payroll_ledger.ledger.exception.DuplicatePostingException;
import com.flagship.payroll_ledger.notification.JournalNotifier;
import com.flagship.payroll_ledger.notification.JournalPostedNotification;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import com.flagship.payroll_ledger.payroll.PayrollRun;
import com.flagship.payroll_ledger.payroll.PayrollRunEntity;
import com.flagship.payroll_ledger.payroll.PayrollRunPersistenceService;
import com.flagship.payroll_ledger.payroll.PayrollRunSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Closes payroll runs by posting their journal.
 *
 * Key principles:
 * - The run state change and the journal are written in one transaction
 * - The run row is locked, so concurrent closes of the same run serialize
 * - Closing twice is a no-op that returns the journal from the first close
 * - The notification goes out only after commit and never undoes the close
 *
 * The transaction is driven with a TransactionTemplate rather than @Transactional:
 * a duplicate posting aborts the Postgres transaction, and the existing journal has
 * to be read back in a fresh one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollCloseService {

    private final PayrollRunPersistenceService persistenceService;
    private final PostingRuleEngine postingRuleEngine;
    private final JournalFactory journalFactory;
    private final LedgerStore ledgerStore;
    private final JournalNotifier journalNotifier;
    private final LedgerMetrics ledgerMetrics;
    private final TransactionTemplate transactionTemplate;

    /**
     * Closes a payroll run.
     *
     * @return POSTED with the new journal, ALREADY_CLOSED with the journal of an earlier close,
     *         or NO_JOURNAL if the run had nothing to post
     * @throws IllegalArgumentException if the run does not exist
     */
    public CloseResult closeRun(UUID payrollRunId) {
        long startTime = System.currentTimeMillis();
        MDC.put("payrollRunId", payrollRunId.toString());

        log.info("Attempting to close payroll run");

        try {
            CloseResult result;
            try {
                result = transactionTemplate.execute(status -> closeInTransaction(payrollRunId));
            } catch (DuplicatePostingException e) {
                log.info("Journal for payroll run was posted concurrently; reading it back");
                result = transactionTemplate.execute(status -> closeInTransaction(payrollRunId));
            }

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordCloseOutcome(result.getOutcome().name().toLowerCase());
            ledgerMetrics.recordCloseDuration(Duration.ofMillis(duration));

            log.info("Payroll run close finished: outcome={}, journalId={}, duration={}ms",
                    result.getOutcome(), result.getJournalId(), duration);

            if (result.getOutcome() == CloseResult.Outcome.POSTED) {
                notifyPosted(SourceReference.payrollRun(payrollRunId), result.getJournal());
            }
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordCloseOutcome("error");
            ledgerMetrics.recordCloseDuration(Duration.ofMillis(duration));
            log.error("Payroll run close failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove("payrollRunId");
            MDC.remove("journalId");
        }
    }

    private CloseResult closeInTransaction(UUID payrollRunId) {
        PayrollRunEntity entity = persistenceService.findByIdForUpdate(payrollRunId)
            .orElseThrow(() -> new IllegalArgumentException("Payroll run not found: " + payrollRunId));
        PayrollRun run = entity.toDomain();

        if (run.isClosed()) {
            Journal journal = run.getJournalId() != null
                ? ledgerStore.findJournal(run.getJournalId()).orElse(null)
                : null;
            log.info("Payroll run already closed: journalId={}", run.getJournalId());
            return CloseResult.alreadyClosed(payrollRunId, journal);
        }

        SourceReference source = SourceReference.payrollRun(payrollRunId);
        Optional<Journal> existing = ledgerStore.findJournalBySource(source);
        if (existing.isPresent()) {
            log.warn("Found journal {} for payroll run in {} status; marking run CLOSED",
                    existing.get().getId(), run.getStatus());
            persistenceService.update(entity, run.close(existing.get().getId()));
            return CloseResult.alreadyClosed(payrollRunId, existing.get());
        }

        PayrollRun closing = run.startClosing();
        persistenceService.update(entity, closing);

        PayrollRunSnapshot snapshot = persistenceService.loadSnapshot(closing);
        List<JournalEntryRequest> entries = postingRuleEngine.deriveEntries(snapshot);

        if (entries.isEmpty()) {
            persistenceService.update(entity, closing.close(null));
            log.info("Payroll run has no postable lines ({} lines); closed without journal",
                    snapshot.getLines().size());
            return CloseResult.noJournal(payrollRunId);
        }

        Journal journal = journalFactory.createJournal(JournalRequest.posted(
            closing.getPeriodEnd(),
            String.format("Payroll run %s (%s)", closing.getName(), closing.getPeriod()),
            entries,
            source
        ));
        MDC.put("journalId", journal.getId().toString());

        persistenceService.update(entity, closing.close(journal.getId()));
        log.debug("Posted journal {} with {} entries", journal.getTransactionNumber(), entries.size());

        return CloseResult.posted(payrollRunId, journal);
    }

    private void notifyPosted(SourceReference source, Journal journal) {
        JournalPostedNotification notification = JournalPostedNotification.of(source, journal);
        try {
            journalNotifier.journalPosted(notification);
        } catch (RuntimeException e) {
            ledgerMetrics.recordNotificationFailure(notification.getEventKind());
            log.error("Failed to send journal-posted notification: journalId={}, error={}",
                    journal.getId(), e.getMessage(), e);
        }
    }
}
