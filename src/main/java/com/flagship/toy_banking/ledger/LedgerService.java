package com.flagship.toy_banking.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reservations and postings against local accounts.
 *
 * Every mutation takes a row lock on the account ({@code SELECT ... FOR UPDATE}) before
 * reading its balance, so concurrent holds on one account are serialized in the database,
 * also across service replicas. The database enforces the rest:
 * - balance >= 0 and 0 <= reserved <= balance (check constraints)
 * - one reservation per (transfer_id, direction) (primary key)
 * - one ledger entry per (transfer_id, account_id, entry_type) (unique constraint)
 *
 * Methods join the caller's transaction, so a ledger change commits together with the
 * transfer or participant record that caused it.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String ACCOUNT_COLUMNS =
        "id, account_number, owner_name, state, balance, reserved, version, created_at";

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Places the origin-side hold for a transfer. Idempotent per transfer id.
     *
     * @throws AccountNotFoundException if the account does not exist
     * @throws IllegalStateException if the account is not ACTIVE
     * @throws InsufficientFundsException if the available balance is below the amount;
     *         nothing has been written and the caller's transaction stays usable
     */
    @Transactional(noRollbackFor = InsufficientFundsException.class)
    public Reservation reserveDebit(UUID transferId, UUID accountId, long amount) {
        requirePositive(amount);
        Account account = lockActiveAccount(accountId);

        Optional<Reservation> existing = findReservation(transferId, ReservationDirection.DEBIT);
        if (existing.isPresent()) {
            log.debug("Debit hold already present for transfer {}", transferId);
            return existing.get();
        }

        if (account.available() < amount) {
            throw new InsufficientFundsException(accountId, amount, account.available());
        }

        jdbcTemplate.update(
            "UPDATE accounts SET reserved = reserved + ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ?",
            amount, accountId);
        return insertReservation(transferId, ReservationDirection.DEBIT, accountId, amount, null);
    }

    /**
     * Places the destination-side hold for an incoming transfer. The balance is untouched
     * until the hold is applied. Idempotent per transfer id.
     */
    @Transactional
    public Reservation reserveCredit(UUID transferId, UUID accountId, long amount, Instant expiresAt) {
        requirePositive(amount);
        lockActiveAccount(accountId);

        Optional<Reservation> existing = findReservation(transferId, ReservationDirection.CREDIT);
        if (existing.isPresent()) {
            log.debug("Credit hold already present for transfer {}", transferId);
            return existing.get();
        }
        return insertReservation(transferId, ReservationDirection.CREDIT, accountId, amount, expiresAt);
    }

    /**
     * Converts a hold into a posted ledger entry and removes the hold.
     *
     * @return true if the hold was applied now, false if it had already been applied
     * @throws IllegalStateException if there is neither a hold nor an earlier posting
     */
    @Transactional
    public boolean apply(UUID transferId, ReservationDirection direction) {
        Optional<Reservation> found = lockReservation(transferId, direction);
        if (found.isEmpty()) {
            if (hasEntry(transferId, direction.entryType())) {
                log.debug("{} of transfer {} already applied", direction, transferId);
                return false;
            }
            throw new IllegalStateException(
                String.format("No %s reservation for transfer %s", direction, transferId));
        }

        Reservation reservation = found.get();
        lockAccount(reservation.getAccountId());

        if (direction == ReservationDirection.DEBIT) {
            jdbcTemplate.update(
                "UPDATE accounts SET balance = balance - ?, reserved = reserved - ?, version = version + 1, " +
                "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                reservation.getAmount(), reservation.getAmount(), reservation.getAccountId());
        } else {
            jdbcTemplate.update(
                "UPDATE accounts SET balance = balance + ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ?",
                reservation.getAmount(), reservation.getAccountId());
        }

        createLedgerEntry(transferId, reservation.getAccountId(), reservation.getAmount(),
            direction.entryType(), String.format("Transfer %s: %s", transferId, direction.name().toLowerCase()));
        deleteReservation(transferId, direction);
        return true;
    }

    /**
     * Drops a hold without posting anything.
     *
     * @return true if a hold existed and was released
     */
    @Transactional
    public boolean release(UUID transferId, ReservationDirection direction) {
        Optional<Reservation> found = lockReservation(transferId, direction);
        if (found.isEmpty()) {
            return false;
        }

        Reservation reservation = found.get();
        if (direction == ReservationDirection.DEBIT) {
            lockAccount(reservation.getAccountId());
            jdbcTemplate.update(
                "UPDATE accounts SET reserved = reserved - ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ?",
                reservation.getAmount(), reservation.getAccountId());
        }
        deleteReservation(transferId, direction);
        return true;
    }

    public Optional<Reservation> findReservation(UUID transferId, ReservationDirection direction) {
        List<Reservation> rows = jdbcTemplate.query(
            "SELECT transfer_id, direction, account_id, amount, expires_at, created_at FROM reservations " +
            "WHERE transfer_id = ? AND direction = ?",
            reservationRowMapper(),
            transferId, direction.name());
        return rows.stream().findFirst();
    }

    public Optional<Account> findAccount(UUID accountId) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ?",
            AccountService.accountRowMapper(),
            accountId);
        return rows.stream().findFirst();
    }

    public List<LedgerEntry> getEntriesForAccount(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT id, transfer_id, account_id, amount, entry_type, description, sequence_number, created_at " +
            "FROM ledger_entries WHERE account_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            accountId);
    }

    public List<LedgerEntry> getEntriesForTransfer(UUID transferId) {
        return jdbcTemplate.query(
            "SELECT id, transfer_id, account_id, amount, entry_type, description, sequence_number, created_at " +
            "FROM ledger_entries WHERE transfer_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transferId);
    }

    void createLedgerEntry(UUID transferId, UUID accountId, long amount, EntryType entryType, String description) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transfer_id, account_id, amount, entry_type, description, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transferId,
            accountId,
            amount,
            entryType.name(),
            description
        );
    }

    private Account lockActiveAccount(UUID accountId) {
        Account account = lockAccount(accountId);
        if (!account.isActive()) {
            throw new IllegalStateException(
                String.format("Account %s is %s", accountId, account.getState()));
        }
        return account;
    }

    private Account lockAccount(UUID accountId) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ? FOR UPDATE",
            AccountService.accountRowMapper(),
            accountId);
        return rows.stream().findFirst().orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private Optional<Reservation> lockReservation(UUID transferId, ReservationDirection direction) {
        List<Reservation> rows = jdbcTemplate.query(
            "SELECT transfer_id, direction, account_id, amount, expires_at, created_at FROM reservations " +
            "WHERE transfer_id = ? AND direction = ? FOR UPDATE",
            reservationRowMapper(),
            transferId, direction.name());
        return rows.stream().findFirst();
    }

    private Reservation insertReservation(UUID transferId, ReservationDirection direction, UUID accountId,
                                          long amount, Instant expiresAt) {
        Instant now = Instant.now();
        jdbcTemplate.update(
            "INSERT INTO reservations (transfer_id, direction, account_id, amount, expires_at, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            transferId,
            direction.name(),
            accountId,
            amount,
            expiresAt != null ? Timestamp.from(expiresAt) : null,
            Timestamp.from(now));
        return new Reservation(transferId, direction, accountId, amount, expiresAt, now);
    }

    private void deleteReservation(UUID transferId, ReservationDirection direction) {
        jdbcTemplate.update("DELETE FROM reservations WHERE transfer_id = ? AND direction = ?",
            transferId, direction.name());
    }

    private boolean hasEntry(UUID transferId, EntryType entryType) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE transfer_id = ? AND entry_type = ?",
            Integer.class,
            transferId, entryType.name());
        return count != null && count > 0;
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }

    private RowMapper<Reservation> reservationRowMapper() {
        return (rs, rowNum) -> {
            Timestamp expiresAt = rs.getTimestamp("expires_at");
            return new Reservation(
                UUID.fromString(rs.getString("transfer_id")),
                ReservationDirection.valueOf(rs.getString("direction")),
                UUID.fromString(rs.getString("account_id")),
                rs.getLong("amount"),
                expiresAt != null ? expiresAt.toInstant() : null,
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> {
            String transferId = rs.getString("transfer_id");
            return new LedgerEntry(
                UUID.fromString(rs.getString("id")),
                transferId != null ? UUID.fromString(transferId) : null,
                UUID.fromString(rs.getString("account_id")),
                rs.getLong("amount"),
                EntryType.valueOf(rs.getString("entry_type")),
                rs.getString("description"),
                rs.getLong("sequence_number"),
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
