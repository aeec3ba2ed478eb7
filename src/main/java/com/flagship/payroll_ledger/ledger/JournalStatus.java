package com.flagship.payroll_ledger.ledger;

/**
 * Lifecycle of a journal.
 *
 * DRAFT journals may still be posted or voided. POSTED and VOID are terminal:
 * a posted journal is corrected only by a new reversing journal.
 */
public enum JournalStatus {
    DRAFT,
    POSTED,
    VOID
}
