package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A journal header together with its entries, as read back from the ledger.
 */
@Value
public class Journal {
    UUID id;
    String transactionNumber;
    JournalStatus status;
    String description;
    LocalDate journalDate;
    SourceReference sourceReference;
    Instant createdAt;
    Instant postedAt;
    List<JournalEntry> entries;

    public boolean isPosted() {
        return status == JournalStatus.POSTED;
    }

    public BigDecimal getDebitTotal() {
        return total(EntryType.DEBIT);
    }

    public BigDecimal getCreditTotal() {
        return total(EntryType.CREDIT);
    }

    /**
     * Total moved by this journal, i.e. the sum of one side.
     */
    public BigDecimal getTotalAmount() {
        return getDebitTotal();
    }

    Journal withEntries(List<JournalEntry> loadedEntries) {
        return new Journal(id, transactionNumber, status, description, journalDate, sourceReference,
            createdAt, postedAt, List.copyOf(loadedEntries));
    }

    private BigDecimal total(EntryType entryType) {
        return entries.stream()
            .filter(entry -> entry.getEntryType() == entryType)
            .map(JournalEntry::getAmount)
            .reduce(BigDecimal.ZERO.setScale(JournalEntryRequest.CURRENCY_SCALE), BigDecimal::add);
    }
}
