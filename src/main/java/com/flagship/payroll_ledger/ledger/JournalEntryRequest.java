package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * One line of a journal to be created: an account number, a side and an amount.
 *
 * Amounts are quantized to two decimal places (HALF_UP) on construction and must
 * remain strictly positive afterwards.
 */
@Value
public class JournalEntryRequest {
    public static final int CURRENCY_SCALE = 2;

    String accountNumber;
    EntryType entryType;
    BigDecimal amount;
    String memo;

    private JournalEntryRequest(String accountNumber, EntryType entryType, BigDecimal amount, String memo) {
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new IllegalArgumentException("Account number is required");
        }
        this.accountNumber = accountNumber;
        this.entryType = Objects.requireNonNull(entryType, "Entry type is required");
        Objects.requireNonNull(amount, "Amount is required");
        BigDecimal quantized = quantize(amount);
        if (quantized.signum() <= 0) {
            throw new IllegalArgumentException(
                String.format("Amount must be positive at 2-decimal precision: %s", amount));
        }
        this.amount = quantized;
        this.memo = memo;
    }

    public static JournalEntryRequest of(String accountNumber, EntryType entryType, BigDecimal amount, String memo) {
        return new JournalEntryRequest(accountNumber, entryType, amount, memo);
    }

    public static JournalEntryRequest debit(String accountNumber, BigDecimal amount, String memo) {
        return new JournalEntryRequest(accountNumber, EntryType.DEBIT, amount, memo);
    }

    public static JournalEntryRequest credit(String accountNumber, BigDecimal amount, String memo) {
        return new JournalEntryRequest(accountNumber, EntryType.CREDIT, amount, memo);
    }

    public static BigDecimal quantize(BigDecimal amount) {
        return amount.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }
}
