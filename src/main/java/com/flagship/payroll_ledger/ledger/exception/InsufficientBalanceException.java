package com.flagship.payroll_ledger.ledger.exception;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Thrown when a posting would drive a balance-constrained account negative.
 */
public class InsufficientBalanceException extends LedgerException {

    private final String accountNumber;
    private final BigDecimal availableBalance;
    private final BigDecimal requiredAmount;
    private final LocalDate asOf;

    public InsufficientBalanceException(String accountNumber, BigDecimal availableBalance,
                                        BigDecimal requiredAmount, LocalDate asOf) {
        super("INSUFFICIENT_BALANCE",
            String.format("Insufficient balance in account %s as of %s: available=%s, required=%s",
                accountNumber, asOf, availableBalance, requiredAmount));
        this.accountNumber = accountNumber;
        this.availableBalance = availableBalance;
        this.requiredAmount = requiredAmount;
        this.asOf = asOf;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public BigDecimal getAvailableBalance() {
        return availableBalance;
    }

    public BigDecimal getRequiredAmount() {
        return requiredAmount;
    }

    public LocalDate getAsOf() {
        return asOf;
    }
}
