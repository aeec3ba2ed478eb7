package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.ledger.exception.InvalidJournalStateException;
import com.flagship.payroll_ledger.ledger.exception.UnbalancedJournalException;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * State transitions of existing journals.
 *
 * DRAFT -> POSTED and DRAFT -> VOID are the only status changes. A posted journal is
 * corrected by reversal: a new posted journal with every side swapped, linked to the
 * original through its source reference. The original is never modified.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalLifecycleService {

    private final LedgerStore ledgerStore;
    private final AccountService accountService;
    private final JournalFactory journalFactory;
    private final BalanceGuard balanceGuard;
    private final LedgerMetrics ledgerMetrics;

    @Transactional(readOnly = true)
    public Journal getJournal(UUID journalId) {
        return ledgerStore.findJournal(journalId)
            .orElseThrow(() -> new IllegalArgumentException("Journal not found: " + journalId));
    }

    /**
     * Posts a DRAFT journal after re-validating its balance and the balance guard.
     */
    @Transactional
    public Journal postJournal(UUID journalId) {
        JournalStatus status = ledgerStore.lockJournal(journalId)
            .orElseThrow(() -> new IllegalArgumentException("Journal not found: " + journalId));
        if (status != JournalStatus.DRAFT) {
            throw new InvalidJournalStateException(journalId, status, "post");
        }

        Journal journal = getJournal(journalId);
        if (journal.getEntries().isEmpty()) {
            throw new InvalidJournalStateException("Journal " + journalId + " has no entries");
        }
        if (journal.getDebitTotal().compareTo(journal.getCreditTotal()) != 0) {
            ledgerMetrics.recordJournalRejected("unbalanced");
            throw new UnbalancedJournalException(journal.getDebitTotal(), journal.getCreditTotal());
        }

        balanceGuard.check(journal.getJournalDate(), toPostingLines(journal));
        ledgerStore.markPosted(journalId);
        log.info("Posted journal {} ({})", journal.getTransactionNumber(), journalId);
        return getJournal(journalId);
    }

    @Transactional
    public Journal voidJournal(UUID journalId) {
        JournalStatus status = ledgerStore.lockJournal(journalId)
            .orElseThrow(() -> new IllegalArgumentException("Journal not found: " + journalId));
        if (status != JournalStatus.DRAFT) {
            throw new InvalidJournalStateException(journalId, status, "void");
        }
        ledgerStore.markVoid(journalId);
        log.info("Voided journal {}", journalId);
        return getJournal(journalId);
    }

    @Transactional
    public Journal reverseJournal(UUID journalId, String reason) {
        return reverseJournal(journalId, reason, LocalDate.now());
    }

    /**
     * Posts a reversal of a POSTED journal dated {@code reversalDate}.
     *
     * @throws InvalidJournalStateException if the journal is not posted or already reversed
     */
    @Transactional
    public Journal reverseJournal(UUID journalId, String reason, LocalDate reversalDate) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A reason is required to reverse a journal");
        }
        Journal original = getJournal(journalId);
        if (original.getStatus() != JournalStatus.POSTED) {
            throw new InvalidJournalStateException(journalId, original.getStatus(), "reverse");
        }
        SourceReference reversalSource = SourceReference.of(SourceKind.JOURNAL_REVERSAL, journalId);
        if (ledgerStore.findJournalBySource(reversalSource).isPresent()) {
            throw new InvalidJournalStateException("Journal " + journalId + " has already been reversed");
        }

        List<JournalEntryRequest> entries = new ArrayList<>(original.getEntries().size());
        for (JournalEntry entry : original.getEntries()) {
            entries.add(JournalEntryRequest.of(
                entry.getAccountNumber(),
                entry.getEntryType().opposite(),
                entry.getAmount(),
                String.format("Reversal of line %d: %s", entry.getLineNumber(),
                    entry.getMemo() != null ? entry.getMemo() : "")
            ));
        }

        Journal reversal = journalFactory.createJournal(JournalRequest.posted(
            reversalDate,
            String.format("REVERSAL: %s (%s)", original.getDescription(), reason),
            entries,
            reversalSource
        ));
        ledgerMetrics.incrementJournalsReversed();
        log.info("Reversed journal {} with {}: reason={}", original.getTransactionNumber(),
            reversal.getTransactionNumber(), reason);
        return reversal;
    }

    private List<PostingLine> toPostingLines(Journal journal) {
        Map<String, Account> accounts = accountService.resolveAll(journal.getEntries().stream()
            .map(JournalEntry::getAccountNumber)
            .collect(Collectors.toCollection(LinkedHashSet::new)));
        List<PostingLine> lines = new ArrayList<>();
        for (JournalEntry entry : journal.getEntries()) {
            lines.add(new PostingLine(accounts.get(entry.getAccountNumber()), entry.getEntryType(),
                entry.getAmount(), entry.getMemo()));
        }
        return lines;
    }
}
