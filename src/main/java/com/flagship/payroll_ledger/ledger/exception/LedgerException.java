package com.flagship.payroll_ledger.ledger.exception;

/**
 * Base exception for ledger posting failures.
 * Every failure of this type means nothing was persisted.
 */
public class LedgerException extends RuntimeException {

    private final String errorCode;

    public LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
