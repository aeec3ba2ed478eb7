package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Request object for creating a journal.
 * Contains the ordered entries that must balance.
 *
 * Invariant: sum of debits must equal sum of credits.
 */
@Value
public class JournalRequest {
    LocalDate date;
    String description;
    List<JournalEntryRequest> entries;
    boolean autoPost;
    SourceReference sourceReference;

    private JournalRequest(LocalDate date, String description, List<JournalEntryRequest> entries,
                           boolean autoPost, SourceReference sourceReference) {
        this.date = Objects.requireNonNull(date, "Journal date is required");
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Journal description is required");
        }
        this.description = description;
        this.entries = List.copyOf(Objects.requireNonNull(entries, "Entries are required"));
        this.autoPost = autoPost;
        this.sourceReference = sourceReference;
    }

    public static JournalRequest of(LocalDate date, String description, List<JournalEntryRequest> entries,
                                    boolean autoPost, SourceReference sourceReference) {
        return new JournalRequest(date, description, entries, autoPost, sourceReference);
    }

    /**
     * A journal posted immediately on creation.
     */
    public static JournalRequest posted(LocalDate date, String description, List<JournalEntryRequest> entries,
                                        SourceReference sourceReference) {
        return new JournalRequest(date, description, entries, true, sourceReference);
    }

    /**
     * A journal left in DRAFT for later review.
     */
    public static JournalRequest draft(LocalDate date, String description, List<JournalEntryRequest> entries) {
        return new JournalRequest(date, description, entries, false, null);
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public BigDecimal getDebitTotal() {
        return total(EntryType.DEBIT);
    }

    public BigDecimal getCreditTotal() {
        return total(EntryType.CREDIT);
    }

    private BigDecimal total(EntryType entryType) {
        return entries.stream()
            .filter(entry -> entry.getEntryType() == entryType)
            .map(JournalEntryRequest::getAmount)
            .reduce(BigDecimal.ZERO.setScale(JournalEntryRequest.CURRENCY_SCALE), BigDecimal::add);
    }
}
