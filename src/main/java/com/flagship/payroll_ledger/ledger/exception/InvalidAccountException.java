package com.flagship.payroll_ledger.ledger.exception;

/**
 * Thrown when a journal references an account number missing from the chart of accounts.
 */
public class InvalidAccountException extends LedgerException {

    private final String accountNumber;

    public InvalidAccountException(String accountNumber) {
        super("INVALID_ACCOUNT", "Account not found: " + accountNumber);
        this.accountNumber = accountNumber;
    }

    public String getAccountNumber() {
        return accountNumber;
    }
}
