package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A persisted debit or credit line of a journal.
 * Immutable once its journal is posted.
 */
@Value
public class JournalEntry {
    UUID id;
    UUID journalId;
    UUID accountId;
    String accountNumber;
    EntryType entryType;
    BigDecimal amount;
    String memo;
    int lineNumber;
}
