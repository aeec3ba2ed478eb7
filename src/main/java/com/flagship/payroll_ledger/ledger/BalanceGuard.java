package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.ledger.exception.InsufficientBalanceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Keeps balance-constrained accounts from going negative.
 *
 * Must be called inside the transaction that posts the journal: the affected account
 * rows are locked first, so two postings against the same account serialize and the
 * second one sees the first one's entries.
 *
 * A journal dated in the past also changes every later balance, so besides the balance
 * as of the journal date the guard replays later posted movements and rejects the
 * posting if any of those balances would turn negative.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceGuard {

    private final LedgerStore ledgerStore;

    /**
     * @throws InsufficientBalanceException if a constrained account would go negative
     */
    public void check(LocalDate journalDate, List<PostingLine> lines) {
        Map<UUID, Account> constrained = new LinkedHashMap<>();
        Map<UUID, BigDecimal> netEffect = new LinkedHashMap<>();
        for (PostingLine line : lines) {
            Account account = line.getAccount();
            if (!account.isBalanceConstrained()) {
                continue;
            }
            constrained.putIfAbsent(account.getId(), account);
            netEffect.merge(account.getId(), line.getSignedAmount(), BigDecimal::add);
        }
        if (constrained.isEmpty()) {
            return;
        }

        ledgerStore.lockAccounts(constrained.keySet());

        for (Account account : constrained.values()) {
            BigDecimal effect = netEffect.get(account.getId());
            BigDecimal current = ledgerStore.getAccountBalance(account, journalDate);
            BigDecimal projected = current.add(effect);
            if (projected.signum() < 0) {
                log.warn("Posting rejected: account={} balance={} effect={} asOf={}",
                    account.getAccountNumber(), current, effect, journalDate);
                throw new InsufficientBalanceException(account.getAccountNumber(), current, effect.negate(), journalDate);
            }
            if (effect.signum() < 0) {
                checkLaterBalances(account, journalDate, projected, effect);
            }
        }
    }

    private void checkLaterBalances(Account account, LocalDate journalDate, BigDecimal projected, BigDecimal effect) {
        BigDecimal running = projected;
        for (LedgerStore.BalanceMovement movement : ledgerStore.findPostedMovementsAfter(account, journalDate)) {
            running = running.add(movement.getNetChange());
            if (running.signum() < 0) {
                BigDecimal available = running.subtract(effect);
                log.warn("Back-dated posting rejected: account={} journalDate={} negativeOn={}",
                    account.getAccountNumber(), journalDate, movement.getDate());
                throw new InsufficientBalanceException(account.getAccountNumber(), available, effect.negate(),
                    movement.getDate());
            }
        }
    }
}
