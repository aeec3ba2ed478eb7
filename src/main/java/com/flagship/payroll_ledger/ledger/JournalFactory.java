package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.ledger.exception.InsufficientBalanceException;
import com.flagship.payroll_ledger.ledger.exception.UnbalancedJournalException;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Creates journals from validated requests.
 *
 * This service enforces the core invariants:
 * 1. Debits must equal credits (balanced journals)
 * 2. Header and entries are written atomically
 * 3. A posted journal never drives a constrained account negative
 * 4. At most one journal exists per source reference
 *
 * The database re-checks the balance of every posted journal at commit time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalFactory {

    private final AccountService accountService;
    private final LedgerStore ledgerStore;
    private final BalanceGuard balanceGuard;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Creates a journal, posting it immediately when the request asks for it.
     *
     * @return the persisted journal with its entries
     * @throws IllegalArgumentException if the request has no entries
     * @throws com.flagship.payroll_ledger.ledger.exception.InvalidAccountException if an account number does not resolve
     * @throws UnbalancedJournalException if debits do not equal credits
     * @throws InsufficientBalanceException if posting would overdraw a constrained account
     * @throws com.flagship.payroll_ledger.ledger.exception.DuplicatePostingException if the source already has a journal
     */
    @Transactional
    public Journal createJournal(JournalRequest request) {
        if (request.getEntries().isEmpty()) {
            throw new IllegalArgumentException("Journal must have at least one entry");
        }

        List<PostingLine> lines = resolveLines(request.getEntries());

        if (!request.isBalanced()) {
            ledgerMetrics.recordJournalRejected("unbalanced");
            throw new UnbalancedJournalException(request.getDebitTotal(), request.getCreditTotal());
        }

        // Lock and check constrained accounts before any row references them
        if (request.isAutoPost()) {
            guard(request, lines);
        }

        UUID journalId = UUID.randomUUID();
        String transactionNumber = ledgerStore.nextTransactionNumber();
        ledgerStore.insertJournal(journalId, transactionNumber, request.getDate(), request.getDescription(),
            request.getSourceReference());

        for (int i = 0; i < lines.size(); i++) {
            ledgerStore.insertEntry(journalId, lines.get(i), i + 1);
        }

        JournalStatus status = JournalStatus.DRAFT;
        if (request.isAutoPost()) {
            ledgerStore.markPosted(journalId);
            status = JournalStatus.POSTED;
        }

        ledgerMetrics.recordJournalCreated(status.name());
        log.info("Created journal {} ({}) status={} entries={} amount={} source={}",
            transactionNumber, journalId, status, lines.size(), request.getDebitTotal(),
            request.getSourceReference());

        return ledgerStore.findJournal(journalId)
            .orElseThrow(() -> new IllegalStateException("Journal not readable after insert: " + journalId));
    }

    private List<PostingLine> resolveLines(List<JournalEntryRequest> entries) {
        Set<String> accountNumbers = new LinkedHashSet<>();
        entries.forEach(entry -> accountNumbers.add(entry.getAccountNumber()));
        Map<String, Account> accounts = accountService.resolveAll(accountNumbers);

        List<PostingLine> lines = new ArrayList<>(entries.size());
        for (JournalEntryRequest entry : entries) {
            lines.add(PostingLine.resolve(entry, accounts.get(entry.getAccountNumber())));
        }
        return lines;
    }

    private void guard(JournalRequest request, List<PostingLine> lines) {
        try {
            balanceGuard.check(request.getDate(), lines);
        } catch (InsufficientBalanceException e) {
            ledgerMetrics.recordJournalRejected("insufficient_balance");
            throw e;
        }
    }
}
