package com.flagship.payroll_ledger.ledger.exception;

/**
 * Thrown when an account referenced by journal entries would be deleted or renumbered.
 */
public class AccountInUseException extends LedgerException {

    public AccountInUseException(String accountNumber) {
        super("ACCOUNT_IN_USE", "Account " + accountNumber + " is referenced by journal entries");
    }
}
