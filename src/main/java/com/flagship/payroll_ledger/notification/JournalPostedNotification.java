package com.flagship.payroll_ledger.notification;

import com.flagship.payroll_ledger.ledger.Journal;
import com.flagship.payroll_ledger.ledger.SourceReference;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published after the transaction that posted a journal for a business event has committed.
 */
@Value
public class JournalPostedNotification {
    String eventKind;
    UUID eventId;
    UUID journalId;
    String transactionNumber;
    BigDecimal totalAmount;
    Instant occurredAt;

    public static JournalPostedNotification of(SourceReference source, Journal journal) {
        return new JournalPostedNotification(
            source.getKind().name(),
            source.getId(),
            journal.getId(),
            journal.getTransactionNumber(),
            journal.getTotalAmount(),
            Instant.now()
        );
    }
}
