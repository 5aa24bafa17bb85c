package com.flagship.toy_banking.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing accounts.
 * An opening balance is posted as an "Initial deposit" ledger entry.
 */
@Service
@Slf4j
public class AccountService {

    static final String INITIAL_DEPOSIT = "Initial deposit";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerService ledgerService;

    public AccountService(JdbcTemplate jdbcTemplate, LedgerService ledgerService) {
        this.jdbcTemplate = jdbcTemplate;
        this.ledgerService = ledgerService;
    }

    @Transactional
    public Account createAccount(String accountNumber, String ownerName, long initialBalance) {
        if (initialBalance < 0) {
            throw new IllegalArgumentException("Initial balance cannot be negative: " + initialBalance);
        }

        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, account_number, owner_name, state, balance, reserved, version, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, 0, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            accountId,
            accountNumber,
            ownerName,
            AccountState.ACTIVE.name(),
            initialBalance
        );
        if (initialBalance > 0) {
            ledgerService.createLedgerEntry(null, accountId, initialBalance, EntryType.CREDIT, INITIAL_DEPOSIT);
        }

        log.info("Account created: accountId={}, accountNumber={}", accountId, accountNumber);
        return getAccount(accountId);
    }

    /**
     * Closes an account for new transfers. Holds already placed are still settled or released.
     */
    @Transactional
    public Account cancelAccount(UUID accountId) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET state = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND state = ?",
            AccountState.CANCELED.name(), accountId, AccountState.ACTIVE.name());
        Account account = getAccount(accountId);
        if (updated > 0) {
            log.info("Account canceled: accountId={}", accountId);
        }
        return account;
    }

    public Account getAccount(UUID accountId) {
        return ledgerService.findAccount(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    public Optional<Account> findAccount(UUID accountId) {
        return ledgerService.findAccount(accountId);
    }

    public List<Account> listAccounts() {
        return jdbcTemplate.query(
            "SELECT id, account_number, owner_name, state, balance, reserved, version, created_at " +
            "FROM accounts ORDER BY created_at, account_number",
            accountRowMapper());
    }

    static RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            rs.getString("account_number"),
            rs.getString("owner_name"),
            AccountState.valueOf(rs.getString("state")),
            rs.getLong("balance"),
            rs.getLong("reserved"),
            rs.getLong("version"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
