package com.flagship.payroll_ledger.ledger;

/**
 * Side of a journal entry in double-entry accounting.
 * Every posted journal must have balanced debits and credits.
 */
public enum EntryType {
    DEBIT,
    CREDIT;

    public EntryType opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
