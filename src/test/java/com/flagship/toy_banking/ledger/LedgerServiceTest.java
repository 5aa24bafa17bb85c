package com.flagship.toy_banking.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger holds and postings against a real database.
 *
 * Attempts to break the account invariants:
 * - available balance never negative
 * - every posting matches exactly one hold
 * - concurrent holds never oversubscribe an account
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("bank.instance-id", () -> "BANKAA");
        registry.add("bank.registry.register-on-startup", () -> "false");
        registry.add("bank.recovery.enabled", () -> "false");
        registry.add("bank.participant.expiry.enabled", () -> "false");
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID accountId;

    @BeforeEach
    void setUp() {
        accountId = openAccount(1000);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("New account posts its initial deposit")
    void testCreateAccount_InitialDeposit() {
        printTestHeader("Create Account");

        Account account = accountService.getAccount(accountId);
        List<LedgerEntry> entries = ledgerService.getEntriesForAccount(accountId);

        printOutput("Account", account);
        assertEquals(AccountState.ACTIVE, account.getState());
        assertEquals(1000, account.getBalance());
        assertEquals(0, account.getReserved());
        assertEquals(1, entries.size());
        assertEquals(EntryType.CREDIT, entries.get(0).getEntryType());
        assertNull(entries.get(0).getTransferId());
        printSuccess("Initial balance recorded as a credit entry");
    }

    @Test
    @DisplayName("Debit hold lowers the available balance only")
    void testReserveDebit_ReducesAvailable() {
        printTestHeader("Reserve Debit");
        UUID transferId = UUID.randomUUID();
        printInput("Amount", 400);

        ledgerService.reserveDebit(transferId, accountId, 400);

        Account account = accountService.getAccount(accountId);
        printOutput("Account", account);
        assertEquals(1000, account.getBalance());
        assertEquals(400, account.getReserved());
        assertEquals(600, account.available());
        assertTrue(ledgerService.findReservation(transferId, ReservationDirection.DEBIT).isPresent());
        printSuccess("Hold placed without posting");
    }

    @Test
    @DisplayName("Repeated debit hold for one transfer is placed once")
    void testReserveDebit_Idempotent() {
        UUID transferId = UUID.randomUUID();

        ledgerService.reserveDebit(transferId, accountId, 300);
        ledgerService.reserveDebit(transferId, accountId, 300);

        assertEquals(300, accountService.getAccount(accountId).getReserved());
    }

    @Test
    @DisplayName("Hold above the available balance is refused")
    void testReserveDebit_InsufficientFunds() {
        printTestHeader("Insufficient Funds");
        ledgerService.reserveDebit(UUID.randomUUID(), accountId, 800);

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> ledgerService.reserveDebit(UUID.randomUUID(), accountId, 300));

        printOutput("Exception", e.getMessage());
        assertEquals(200, e.getAvailable());
        assertEquals(800, accountService.getAccount(accountId).getReserved());
        printSuccess("Available balance cannot go negative");
    }

    @Test
    @DisplayName("Hold on a canceled or missing account is refused")
    void testReserveDebit_InactiveAccount() {
        accountService.cancelAccount(accountId);

        assertThrows(IllegalStateException.class,
                () -> ledgerService.reserveDebit(UUID.randomUUID(), accountId, 100));
        assertThrows(AccountNotFoundException.class,
                () -> ledgerService.reserveDebit(UUID.randomUUID(), UUID.randomUUID(), 100));
        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.reserveDebit(UUID.randomUUID(), openAccount(100), 0));
    }

    @Test
    @DisplayName("Applying a debit hold posts exactly one entry")
    void testApplyDebit() {
        printTestHeader("Apply Debit");
        UUID transferId = UUID.randomUUID();
        ledgerService.reserveDebit(transferId, accountId, 250);

        assertTrue(ledgerService.apply(transferId, ReservationDirection.DEBIT));
        assertFalse(ledgerService.apply(transferId, ReservationDirection.DEBIT));

        Account account = accountService.getAccount(accountId);
        List<LedgerEntry> entries = ledgerService.getEntriesForTransfer(transferId);
        printOutput("Account", account);
        printOutput("Entries", entries);
        assertEquals(750, account.getBalance());
        assertEquals(0, account.getReserved());
        assertEquals(1, entries.size());
        assertEquals(EntryType.DEBIT, entries.get(0).getEntryType());
        assertEquals(250, entries.get(0).getAmount());
        assertTrue(ledgerService.findReservation(transferId, ReservationDirection.DEBIT).isEmpty());
        printSuccess("Second apply is a no-op");
    }

    @Test
    @DisplayName("Credit hold changes nothing until applied")
    void testCreditHoldAndApply() {
        UUID transferId = UUID.randomUUID();

        ledgerService.reserveCredit(transferId, accountId, 500, Instant.now().plusSeconds(30));
        assertEquals(1000, accountService.getAccount(accountId).getBalance());
        assertEquals(0, accountService.getAccount(accountId).getReserved());

        ledgerService.apply(transferId, ReservationDirection.CREDIT);
        assertEquals(1500, accountService.getAccount(accountId).getBalance());
        assertEquals(EntryType.CREDIT, ledgerService.getEntriesForTransfer(transferId).get(0).getEntryType());
    }

    @Test
    @DisplayName("Released hold restores the available balance and posts nothing")
    void testRelease() {
        UUID transferId = UUID.randomUUID();
        ledgerService.reserveDebit(transferId, accountId, 600);

        assertTrue(ledgerService.release(transferId, ReservationDirection.DEBIT));
        assertFalse(ledgerService.release(transferId, ReservationDirection.DEBIT));

        Account account = accountService.getAccount(accountId);
        assertEquals(1000, account.available());
        assertTrue(ledgerService.getEntriesForTransfer(transferId).isEmpty());
    }

    @Test
    @DisplayName("Applying without a hold fails")
    void testApply_NoReservation() {
        assertThrows(IllegalStateException.class,
                () -> ledgerService.apply(UUID.randomUUID(), ReservationDirection.CREDIT));
    }

    @Test
    @DisplayName("Database rejects a reserved amount above the balance")
    void testConstraint_ReservedAboveBalance() {
        printTestHeader("Check Constraint");

        assertThrows(DataIntegrityViolationException.class, () ->
                jdbcTemplate.update("UPDATE accounts SET reserved = balance + 1 WHERE id = ?", accountId));
        assertThrows(DataIntegrityViolationException.class, () ->
                jdbcTemplate.update("UPDATE accounts SET balance = -1 WHERE id = ?", accountId));
        printSuccess("Schema enforces the balance invariants");
    }

    @Test
    @DisplayName("Concurrent holds never oversubscribe an account")
    void testConcurrentReservations() throws Exception {
        printTestHeader("Concurrent Reservations");
        UUID limited = openAccount(500);
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger reserved = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                start.await();
                try {
                    ledgerService.reserveDebit(UUID.randomUUID(), limited, 100);
                    reserved.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    refused.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        printOutput("Reserved", reserved.get());
        printOutput("Refused", refused.get());
        assertEquals(5, reserved.get());
        assertEquals(5, refused.get());
        assertEquals(500, accountService.getAccount(limited).getReserved());
        printSuccess("Row lock serializes the holds");
    }

    private UUID openAccount(long balance) {
        String number = "ACC-" + UUID.randomUUID().toString().substring(0, 8);
        return accountService.createAccount(number, "Test Owner", balance).getId();
    }
}
