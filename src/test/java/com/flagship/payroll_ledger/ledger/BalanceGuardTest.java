package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.ledger.exception.InsufficientBalanceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BalanceGuardTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    private LedgerStore ledgerStore;
    private BalanceGuard balanceGuard;

    private Account cash;
    private Account expense;
    private Account payable;

    @BeforeEach
    void setUp() {
        ledgerStore = mock(LedgerStore.class);
        balanceGuard = new BalanceGuard(ledgerStore);

        cash = new Account(UUID.randomUUID(), "1100", "Cash", Account.AccountType.ASSET, true);
        expense = new Account(UUID.randomUUID(), "6010", "Salaries", Account.AccountType.EXPENSE, false);
        payable = new Account(UUID.randomUUID(), "2110", "PAYE", Account.AccountType.LIABILITY, false);
    }

    @Test
    @DisplayName("Journals touching no constrained account take no locks")
    void testUnconstrainedAccounts_NoLocks() {
        balanceGuard.check(DATE, List.of(
            new PostingLine(expense, EntryType.DEBIT, new BigDecimal("50.00"), null),
            new PostingLine(payable, EntryType.CREDIT, new BigDecimal("50.00"), null)
        ));

        verify(ledgerStore, never()).lockAccounts(anyCollection());
        verify(ledgerStore, never()).getAccountBalance(any(Account.class), any());
    }

    @Test
    @DisplayName("Credit within available balance is allowed")
    void testSufficientBalance() {
        when(ledgerStore.getAccountBalance(cash, DATE)).thenReturn(new BigDecimal("100.00"));
        when(ledgerStore.findPostedMovementsAfter(cash, DATE)).thenReturn(List.of());

        balanceGuard.check(DATE, List.of(
            new PostingLine(expense, EntryType.DEBIT, new BigDecimal("100.00"), null),
            new PostingLine(cash, EntryType.CREDIT, new BigDecimal("100.00"), null)
        ));

        verify(ledgerStore).lockAccounts(Set.of(cash.getId()));
    }

    @Test
    @DisplayName("Credit beyond available balance is rejected")
    void testInsufficientBalance_ShouldFail() {
        when(ledgerStore.getAccountBalance(cash, DATE)).thenReturn(new BigDecimal("40.00"));

        InsufficientBalanceException exception = assertThrows(InsufficientBalanceException.class,
            () -> balanceGuard.check(DATE, List.of(
                new PostingLine(expense, EntryType.DEBIT, new BigDecimal("50.00"), null),
                new PostingLine(cash, EntryType.CREDIT, new BigDecimal("50.00"), null)
            )));

        assertEquals("1100", exception.getAccountNumber());
        assertEquals(new BigDecimal("40.00"), exception.getAvailableBalance());
        assertEquals(new BigDecimal("50.00"), exception.getRequiredAmount());
        assertEquals(DATE, exception.getAsOf());
        assertEquals("INSUFFICIENT_BALANCE", exception.getErrorCode());
    }

    @Test
    @DisplayName("Debits and credits to the same account are netted")
    void testNetEffectPerAccount() {
        when(ledgerStore.getAccountBalance(cash, DATE)).thenReturn(new BigDecimal("10.00"));
        when(ledgerStore.findPostedMovementsAfter(cash, DATE)).thenReturn(List.of());

        // -30 + 25 = -5 against a balance of 10
        balanceGuard.check(DATE, List.of(
            new PostingLine(cash, EntryType.CREDIT, new BigDecimal("30.00"), null),
            new PostingLine(cash, EntryType.DEBIT, new BigDecimal("25.00"), null),
            new PostingLine(expense, EntryType.DEBIT, new BigDecimal("5.00"), null)
        ));
    }

    @Test
    @DisplayName("Back-dated credit that makes a later balance negative is rejected")
    void testBackDatedPosting_LaterBalanceNegative_ShouldFail() {
        LocalDate later = DATE.plusDays(5);
        when(ledgerStore.getAccountBalance(cash, DATE)).thenReturn(new BigDecimal("100.00"));
        when(ledgerStore.findPostedMovementsAfter(cash, DATE)).thenReturn(List.of(
            new LedgerStore.BalanceMovement(later, new BigDecimal("-80.00"))
        ));

        InsufficientBalanceException exception = assertThrows(InsufficientBalanceException.class,
            () -> balanceGuard.check(DATE, List.of(
                new PostingLine(expense, EntryType.DEBIT, new BigDecimal("50.00"), null),
                new PostingLine(cash, EntryType.CREDIT, new BigDecimal("50.00"), null)
            )));

        assertEquals(later, exception.getAsOf());
        assertEquals(new BigDecimal("20.00"), exception.getAvailableBalance());
        assertEquals(new BigDecimal("50.00"), exception.getRequiredAmount());
    }

    @Test
    @DisplayName("Back-dated credit that keeps later balances at zero or above is allowed")
    void testBackDatedPosting_LaterBalanceZero() {
        when(ledgerStore.getAccountBalance(cash, DATE)).thenReturn(new BigDecimal("100.00"));
        when(ledgerStore.findPostedMovementsAfter(cash, DATE)).thenReturn(List.of(
            new LedgerStore.BalanceMovement(DATE.plusDays(5), new BigDecimal("-80.00"))
        ));

        balanceGuard.check(DATE, List.of(
            new PostingLine(expense, EntryType.DEBIT, new BigDecimal("20.00"), null),
            new PostingLine(cash, EntryType.CREDIT, new BigDecimal("20.00"), null)
        ));
    }

    @Test
    @DisplayName("Debits to a constrained account never need the later-balance walk")
    void testDebitToConstrainedAccount_SkipsLaterBalances() {
        when(ledgerStore.getAccountBalance(cash, DATE)).thenReturn(BigDecimal.ZERO);

        balanceGuard.check(DATE, List.of(
            new PostingLine(cash, EntryType.DEBIT, new BigDecimal("500.00"), null),
            new PostingLine(payable, EntryType.CREDIT, new BigDecimal("500.00"), null)
        ));

        verify(ledgerStore).lockAccounts(Set.of(cash.getId()));
        verify(ledgerStore, never()).findPostedMovementsAfter(any(), any());
    }
}
