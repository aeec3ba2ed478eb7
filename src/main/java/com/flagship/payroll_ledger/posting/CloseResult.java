package com.flagship.payroll_ledger.posting;

import com.flagship.payroll_ledger.ledger.Journal;
import lombok.Value;

import java.util.UUID;

/**
 * Result of closing a payroll run.
 */
@Value
public class CloseResult {
    UUID payrollRunId;
    Outcome outcome;
    Journal journal;

    public enum Outcome {
        /** This call posted the run's journal. */
        POSTED,
        /** The run was already closed; the existing journal, if any, is returned. */
        ALREADY_CLOSED,
        /** The run had nothing to post and closed without a journal. */
        NO_JOURNAL
    }

    public static CloseResult posted(UUID payrollRunId, Journal journal) {
        return new CloseResult(payrollRunId, Outcome.POSTED, journal);
    }

    public static CloseResult alreadyClosed(UUID payrollRunId, Journal journal) {
        return new CloseResult(payrollRunId, Outcome.ALREADY_CLOSED, journal);
    }

    public static CloseResult noJournal(UUID payrollRunId) {
        return new CloseResult(payrollRunId, Outcome.NO_JOURNAL, null);
    }

    public boolean hasJournal() {
        return journal != null;
    }

    public UUID getJournalId() {
        return journal != null ? journal.getId() : null;
    }
}
