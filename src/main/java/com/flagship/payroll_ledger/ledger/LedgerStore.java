package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.ledger.exception.DuplicatePostingException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent record of journals and their entries.
 *
 * Uses JDBC directly so the SQL that enforces correctness stays visible:
 * - unique (source_kind, source_id) gives one journal per business event
 * - deferred triggers reject unbalanced posted journals at commit
 * - balances are always derived from posted entries, never stored
 *
 * All writes are expected to run inside the caller's transaction.
 */
@Repository
@Slf4j
public class LedgerStore {

    private static final String SOURCE_CONSTRAINT = "uq_journals_source";

    private static final String SELECT_JOURNAL =
        "SELECT id, transaction_number, status, description, journal_date, source_kind, source_id, " +
        "created_at, posted_at FROM journals ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public LedgerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    /**
     * Next journal number, e.g. TXN000042. Backed by a database sequence.
     */
    public String nextTransactionNumber() {
        Long next = jdbcTemplate.queryForObject("SELECT nextval('journal_number_seq')", Long.class);
        return String.format("TXN%06d", next);
    }

    /**
     * Inserts a journal header in DRAFT status.
     *
     * @throws DuplicatePostingException if a journal already exists for the source reference
     */
    public void insertJournal(UUID journalId, String transactionNumber, LocalDate date, String description,
                              SourceReference sourceReference) {
        try {
            jdbcTemplate.update(
                "INSERT INTO journals (id, transaction_number, status, description, journal_date, " +
                "source_kind, source_id, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
                journalId,
                transactionNumber,
                JournalStatus.DRAFT.name(),
                description,
                Date.valueOf(date),
                sourceReference != null ? sourceReference.getKind().name() : null,
                sourceReference != null ? sourceReference.getId() : null
            );
        } catch (DuplicateKeyException e) {
            if (sourceReference != null && mentionsSourceConstraint(e)) {
                throw new DuplicatePostingException(sourceReference, e);
            }
            throw e;
        }
    }

    public void insertEntry(UUID journalId, PostingLine line, int lineNumber) {
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, journal_id, account_id, entry_type, amount, memo, line_number, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            UUID.randomUUID(),
            journalId,
            line.getAccount().getId(),
            line.getEntryType().name(),
            line.getAmount(),
            line.getMemo(),
            lineNumber
        );
    }

    /**
     * Transitions a DRAFT journal to POSTED.
     *
     * @return true if the journal was in DRAFT and is now POSTED
     */
    public boolean markPosted(UUID journalId) {
        return jdbcTemplate.update(
            "UPDATE journals SET status = 'POSTED', posted_at = CURRENT_TIMESTAMP WHERE id = ? AND status = 'DRAFT'",
            journalId) == 1;
    }

    /**
     * Transitions a DRAFT journal to VOID.
     */
    public boolean markVoid(UUID journalId) {
        return jdbcTemplate.update(
            "UPDATE journals SET status = 'VOID' WHERE id = ? AND status = 'DRAFT'",
            journalId) == 1;
    }

    /**
     * Locks a journal header row for the rest of the transaction.
     */
    public Optional<JournalStatus> lockJournal(UUID journalId) {
        return jdbcTemplate.query("SELECT status FROM journals WHERE id = ? FOR UPDATE",
                (rs, rowNum) -> JournalStatus.valueOf(rs.getString("status")), journalId)
            .stream()
            .findFirst();
    }

    public Optional<Journal> findJournal(UUID journalId) {
        return jdbcTemplate.query(SELECT_JOURNAL + "WHERE id = ?", journalRowMapper(), journalId)
            .stream()
            .findFirst()
            .map(journal -> journal.withEntries(findEntries(journal.getId())));
    }

    public Optional<Journal> findJournalBySource(SourceReference sourceReference) {
        return jdbcTemplate.query(SELECT_JOURNAL + "WHERE source_kind = ? AND source_id = ?",
                journalRowMapper(), sourceReference.getKind().name(), sourceReference.getId())
            .stream()
            .findFirst()
            .map(journal -> journal.withEntries(findEntries(journal.getId())));
    }

    public List<JournalEntry> findEntries(UUID journalId) {
        return jdbcTemplate.query(
            "SELECT e.id, e.journal_id, e.account_id, a.account_number, e.entry_type, e.amount, e.memo, e.line_number " +
            "FROM journal_entries e JOIN accounts a ON a.id = e.account_id " +
            "WHERE e.journal_id = ? ORDER BY e.line_number",
            entryRowMapper(),
            journalId
        );
    }

    /**
     * Row-locks the given accounts in a fixed order so concurrent postings against the
     * same accounts serialize instead of deadlocking.
     *
     * NO KEY UPDATE does not conflict with the KEY SHARE locks that entry inserts take
     * on referenced accounts through the foreign key.
     */
    public void lockAccounts(Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return;
        }
        namedJdbcTemplate.query(
            "SELECT id FROM accounts WHERE id IN (:ids) ORDER BY id FOR NO KEY UPDATE",
            new MapSqlParameterSource("ids", accountIds),
            (rs, rowNum) -> rs.getObject("id", UUID.class)
        );
    }

    /**
     * Balance of an account from all POSTED entries dated on or before {@code asOf}.
     * ASSET/EXPENSE: debits minus credits. LIABILITY/EQUITY/REVENUE: credits minus debits.
     */
    public BigDecimal getAccountBalance(Account account, LocalDate asOf) {
        BigDecimal[] totals = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN e.entry_type = 'DEBIT' THEN e.amount ELSE 0 END), 0) AS debits, " +
            "       COALESCE(SUM(CASE WHEN e.entry_type = 'CREDIT' THEN e.amount ELSE 0 END), 0) AS credits " +
            "FROM journal_entries e JOIN journals j ON j.id = e.journal_id " +
            "WHERE e.account_id = ? AND j.status = 'POSTED' AND j.journal_date <= ?",
            (rs, rowNum) -> new BigDecimal[] {rs.getBigDecimal("debits"), rs.getBigDecimal("credits")},
            account.getId(),
            Date.valueOf(asOf)
        );
        return signedBalance(account, totals[0], totals[1]);
    }

    public BigDecimal getAccountBalance(UUID accountId, LocalDate asOf) {
        Account account = jdbcTemplate.query(
                "SELECT id, account_number, name, account_type, balance_constrained FROM accounts WHERE id = ?",
                AccountService.accountRowMapper(), accountId)
            .stream()
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
        return getAccountBalance(account, asOf);
    }

    /**
     * Net balance movement per day for POSTED entries dated strictly after {@code after},
     * in date order.
     */
    public List<BalanceMovement> findPostedMovementsAfter(Account account, LocalDate after) {
        return jdbcTemplate.query(
            "SELECT j.journal_date, " +
            "       COALESCE(SUM(CASE WHEN e.entry_type = 'DEBIT' THEN e.amount ELSE 0 END), 0) AS debits, " +
            "       COALESCE(SUM(CASE WHEN e.entry_type = 'CREDIT' THEN e.amount ELSE 0 END), 0) AS credits " +
            "FROM journal_entries e JOIN journals j ON j.id = e.journal_id " +
            "WHERE e.account_id = ? AND j.status = 'POSTED' AND j.journal_date > ? " +
            "GROUP BY j.journal_date ORDER BY j.journal_date",
            (rs, rowNum) -> new BalanceMovement(
                rs.getDate("journal_date").toLocalDate(),
                signedBalance(account, rs.getBigDecimal("debits"), rs.getBigDecimal("credits"))),
            account.getId(),
            Date.valueOf(after)
        );
    }

    /**
     * Posted journals whose entries do not balance. Always zero unless the
     * database guards have been bypassed.
     */
    public long countUnbalancedPostedJournals() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM (" +
            "  SELECT j.id FROM journals j LEFT JOIN journal_entries e ON e.journal_id = j.id " +
            "  WHERE j.status = 'POSTED' GROUP BY j.id " +
            "  HAVING COALESCE(SUM(CASE WHEN e.entry_type = 'DEBIT' THEN e.amount ELSE 0 END), 0) " +
            "      <> COALESCE(SUM(CASE WHEN e.entry_type = 'CREDIT' THEN e.amount ELSE 0 END), 0)" +
            ") unbalanced",
            Long.class
        );
        return count != null ? count : 0L;
    }

    private static BigDecimal signedBalance(Account account, BigDecimal debits, BigDecimal credits) {
        return account.getAccountType().isDebitNormal() ? debits.subtract(credits) : credits.subtract(debits);
    }

    private static boolean mentionsSourceConstraint(DuplicateKeyException e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause.getMessage() != null && cause.getMessage().contains(SOURCE_CONSTRAINT)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private RowMapper<Journal> journalRowMapper() {
        return (rs, rowNum) -> {
            String sourceKind = rs.getString("source_kind");
            SourceReference sourceReference = sourceKind != null
                ? SourceReference.of(SourceKind.valueOf(sourceKind), rs.getObject("source_id", UUID.class))
                : null;
            Timestamp postedAt = rs.getTimestamp("posted_at");
            return new Journal(
                rs.getObject("id", UUID.class),
                rs.getString("transaction_number"),
                JournalStatus.valueOf(rs.getString("status")),
                rs.getString("description"),
                rs.getDate("journal_date").toLocalDate(),
                sourceReference,
                rs.getTimestamp("created_at").toInstant(),
                postedAt != null ? postedAt.toInstant() : null,
                List.of()
            );
        };
    }

    private RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> new JournalEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("journal_id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getString("account_number"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getBigDecimal("amount"),
            rs.getString("memo"),
            rs.getInt("line_number")
        );
    }

    /**
     * Signed change to an account balance on one day.
     */
    @Value
    public static class BalanceMovement {
        LocalDate date;
        BigDecimal netChange;
    }
}
