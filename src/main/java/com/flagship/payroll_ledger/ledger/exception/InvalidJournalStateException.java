package com.flagship.payroll_ledger.ledger.exception;

import com.flagship.payroll_ledger.ledger.JournalStatus;

import java.util.UUID;

/**
 * Thrown for lifecycle operations not allowed in the journal's current status.
 */
public class InvalidJournalStateException extends LedgerException {

    public InvalidJournalStateException(UUID journalId, JournalStatus status, String operation) {
        super("INVALID_JOURNAL_STATE",
            String.format("Cannot %s journal %s in %s status", operation, journalId, status));
    }

    public InvalidJournalStateException(String message) {
        super("INVALID_JOURNAL_STATE", message);
    }
}
