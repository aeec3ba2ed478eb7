package com.flagship.payroll_ledger.posting;

import com.flagship.payroll_ledger.ledger.Journal;
import com.flagship.payroll_ledger.ledger.JournalEntryRequest;
import com.flagship.payroll_ledger.ledger.JournalFactory;
import com.flagship.payroll_ledger.ledger.JournalRequest;
import com.flagship.payroll_ledger.ledger.LedgerStore;
import com.flagship.payroll_ledger.ledger.SourceKind;
import com.flagship.payroll_ledger.ledger.SourceReference;
import com.flagship.payroll_ledger.ledger.exception.DuplicatePostingException;
import com.flagship.payroll_ledger.notification.JournalNotifier;
import com.flagship.payroll_ledger.notification.JournalPostedNotification;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Posts the cash paid out for an approved employee advance (IOU).
 *
 * DEBIT Employee Advances / CREDIT Cash, one journal per advance. Posting the same
 * advance again returns the journal from the first posting. The advance is recovered
 * later through IOU_RECOVERY pay components on payroll runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdvanceDisbursementService {

    private final JournalFactory journalFactory;
    private final LedgerStore ledgerStore;
    private final PayrollPostingSettings settings;
    private final JournalNotifier journalNotifier;
    private final LedgerMetrics ledgerMetrics;
    private final TransactionTemplate transactionTemplate;

    /**
     * @throws com.flagship.payroll_ledger.ledger.exception.InsufficientBalanceException if cash would go negative
     */
    public Journal postAdvance(UUID advanceId, String employeeId, BigDecimal amount, LocalDate disbursementDate) {
        SourceReference source = SourceReference.of(SourceKind.EMPLOYEE_ADVANCE, advanceId);

        Optional<Journal> existing = ledgerStore.findJournalBySource(source);
        if (existing.isPresent()) {
            log.info("Advance {} already posted as {}", advanceId, existing.get().getTransactionNumber());
            return existing.get();
        }

        JournalRequest request = JournalRequest.posted(
            disbursementDate,
            String.format("Employee advance %s for %s", advanceId, employeeId),
            List.of(
                JournalEntryRequest.debit(settings.getEmployeeAdvancesAccount(), amount,
                    "Advance to employee " + employeeId),
                JournalEntryRequest.credit(settings.getCashAccount(), amount,
                    "Advance paid to employee " + employeeId)
            ),
            source
        );

        Journal journal;
        try {
            journal = transactionTemplate.execute(status -> journalFactory.createJournal(request));
        } catch (DuplicatePostingException e) {
            log.info("Advance {} was posted concurrently; returning existing journal", advanceId);
            return ledgerStore.findJournalBySource(source)
                .orElseThrow(() -> new IllegalStateException("Journal for " + source + " vanished", e));
        }

        log.info("Posted advance {} for employee {}: journal={}, amount={}",
                advanceId, employeeId, journal.getTransactionNumber(), journal.getTotalAmount());

        JournalPostedNotification notification = JournalPostedNotification.of(source, journal);
        try {
            journalNotifier.journalPosted(notification);
        } catch (RuntimeException e) {
            ledgerMetrics.recordNotificationFailure(notification.getEventKind());
            log.error("Failed to send journal-posted notification: journalId={}, error={}",
                    journal.getId(), e.getMessage(), e);
        }
        return journal;
    }
}
