package com.flagship.payroll_ledger.ledger.exception;

import java.math.BigDecimal;

/**
 * Thrown when a journal's debits do not equal its credits.
 */
public class UnbalancedJournalException extends LedgerException {

    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;

    public UnbalancedJournalException(BigDecimal totalDebits, BigDecimal totalCredits) {
        super("JOURNAL_NOT_BALANCED",
            String.format("Journal is not balanced: debits=%s, credits=%s, difference=%s",
                totalDebits, totalCredits, totalDebits.subtract(totalCredits)));
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
    }

    public BigDecimal getTotalDebits() {
        return totalDebits;
    }

    public BigDecimal getTotalCredits() {
        return totalCredits;
    }

    public BigDecimal getDifference() {
        return totalDebits.subtract(totalCredits);
    }
}
