package com.flagship.payroll_ledger.ledger.exception;

import com.flagship.payroll_ledger.ledger.SourceReference;

/**
 * Thrown when a journal already exists for a source reference.
 * Callers closing a business event treat this as "already posted", not as a failure.
 */
public class DuplicatePostingException extends LedgerException {

    private final SourceReference sourceReference;

    public DuplicatePostingException(SourceReference sourceReference, Throwable cause) {
        super("DUPLICATE_POSTING", "A journal already exists for source " + sourceReference, cause);
        this.sourceReference = sourceReference;
    }

    public SourceReference getSourceReference() {
        return sourceReference;
    }
}
