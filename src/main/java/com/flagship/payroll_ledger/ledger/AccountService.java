package com.flagship.payroll_ledger.ledger;

import com.flagship.payroll_ledger.ledger.exception.AccountInUseException;
import com.flagship.payroll_ledger.ledger.exception.InvalidAccountException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Chart of accounts.
 *
 * Accounts are created administratively. Once an entry references an account its
 * number is frozen and the account can no longer be deleted.
 */
@Service
@Slf4j
public class AccountService {

    private static final String SELECT_ACCOUNT =
        "SELECT id, account_number, name, account_type, balance_constrained FROM accounts ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    /**
     * Creates an account; asset accounts are balance-constrained by default.
     */
    public Account createAccount(String accountNumber, String name, Account.AccountType accountType) {
        return createAccount(accountNumber, name, accountType, accountType == Account.AccountType.ASSET);
    }

    public Account createAccount(String accountNumber, String name, Account.AccountType accountType,
                                 boolean balanceConstrained) {
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new IllegalArgumentException("Account number is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, account_number, name, account_type, balance_constrained, created_at) " +
            "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            accountId,
            accountNumber,
            name,
            accountType.name(),
            balanceConstrained
        );
        log.info("Created account {} ({}) type={} constrained={}", accountNumber, name, accountType, balanceConstrained);
        return new Account(accountId, accountNumber, name, accountType, balanceConstrained);
    }

    public Optional<Account> findByNumber(String accountNumber) {
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE account_number = ?", accountRowMapper(), accountNumber)
            .stream()
            .findFirst();
    }

    public Account getByNumber(String accountNumber) {
        return findByNumber(accountNumber).orElseThrow(() -> new InvalidAccountException(accountNumber));
    }

    public Optional<Account> findById(UUID accountId) {
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = ?", accountRowMapper(), accountId)
            .stream()
            .findFirst();
    }

    /**
     * Resolves a set of account numbers in one query.
     *
     * @return accounts keyed by account number, in the iteration order of the argument
     * @throws InvalidAccountException for the first number that does not resolve
     */
    public Map<String, Account> resolveAll(Collection<String> accountNumbers) {
        if (accountNumbers.isEmpty()) {
            return Map.of();
        }
        List<Account> found = namedJdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE account_number IN (:numbers)",
            new MapSqlParameterSource("numbers", accountNumbers),
            accountRowMapper()
        );
        Map<String, Account> byNumber = new LinkedHashMap<>();
        found.forEach(account -> byNumber.put(account.getAccountNumber(), account));

        Map<String, Account> resolved = new LinkedHashMap<>();
        for (String accountNumber : accountNumbers) {
            Account account = byNumber.get(accountNumber);
            if (account == null) {
                throw new InvalidAccountException(accountNumber);
            }
            resolved.put(accountNumber, account);
        }
        return resolved;
    }

    /**
     * Changes an account number while nothing has been posted against it.
     */
    @Transactional
    public void changeAccountNumber(UUID accountId, String newAccountNumber) {
        Account account = findById(accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
        if (isReferenced(accountId)) {
            throw new AccountInUseException(account.getAccountNumber());
        }
        jdbcTemplate.update("UPDATE accounts SET account_number = ? WHERE id = ?", newAccountNumber, accountId);
        log.info("Renumbered account {} -> {}", account.getAccountNumber(), newAccountNumber);
    }

    /**
     * Deletes an account that no journal entry references.
     */
    @Transactional
    public void deleteAccount(UUID accountId) {
        Account account = findById(accountId)
            .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
        if (isReferenced(accountId)) {
            throw new AccountInUseException(account.getAccountNumber());
        }
        jdbcTemplate.update("DELETE FROM accounts WHERE id = ?", accountId);
        log.info("Deleted account {}", account.getAccountNumber());
    }

    public boolean isReferenced(UUID accountId) {
        Boolean referenced = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM journal_entries WHERE account_id = ?)",
            Boolean.class,
            accountId
        );
        return Boolean.TRUE.equals(referenced);
    }

    static RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getObject("id", UUID.class),
            rs.getString("account_number"),
            rs.getString("name"),
            Account.AccountType.valueOf(rs.getString("account_type")),
            rs.getBoolean("balance_constrained")
        );
    }
}
