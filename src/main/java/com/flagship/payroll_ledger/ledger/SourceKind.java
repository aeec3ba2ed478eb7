package com.flagship.payroll_ledger.ledger;

/**
 * Kinds of business events that may own a journal.
 * Each (kind, id) pair owns at most one journal.
 */
public enum SourceKind {
    PAYROLL_RUN,
    EMPLOYEE_ADVANCE,
    JOURNAL_REVERSAL
}
