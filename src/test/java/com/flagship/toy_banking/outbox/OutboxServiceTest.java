package com.flagship.toy_banking.outbox;

import com.flagship.toy_banking.transfer.Transfer;
import com.flagship.toy_banking.transfer.event.TransferCommittedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes share the fate of the business transaction that makes them.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

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
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository repository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Event saved in a committed transaction is stored unpublished")
    void testSaveEvent_Committed() {
        printTestHeader("Save Event");
        UUID transferId = UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> outboxService.saveEvent(
                "Transfer", transferId, TransferCommittedEvent.EVENT_TYPE, committed(transferId)));

        List<OutboxEvent> events = outboxService.getEventsForAggregate("Transfer", transferId);
        printOutput("Events", events);
        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        assertNotNull(event.getSequenceNumber());
        assertTrue(event.getPayload().contains(transferId.toString()));
        assertEquals(1, outboxService.countUnpublished());
        printSuccess("Event stored with its transfer");
    }

    @Test
    @DisplayName("Rolled back transaction leaves no event")
    void testSaveEvent_RolledBack() {
        UUID transferId = UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent("Transfer", transferId, TransferCommittedEvent.EVENT_TYPE, committed(transferId));
            status.setRollbackOnly();
        });

        assertTrue(outboxService.getEventsForAggregate("Transfer", transferId).isEmpty());
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void testSaveEvent_NoTransaction() {
        UUID transferId = UUID.randomUUID();

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(
                "Transfer", transferId, TransferCommittedEvent.EVENT_TYPE, committed(transferId)));
    }

    @Test
    @DisplayName("Events keep their write order and leave the queue once published")
    void testOrderingAndPublished() {
        UUID transferId = UUID.randomUUID();
        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent("Transfer", transferId, "TransferInitiated", committed(transferId));
            outboxService.saveEvent("Transfer", transferId, TransferCommittedEvent.EVENT_TYPE, committed(transferId));
        });

        List<OutboxEvent> publishable = outboxService.findPublishableEvents(5, 10);
        assertEquals(List.of("TransferInitiated", TransferCommittedEvent.EVENT_TYPE),
                publishable.stream().map(OutboxEvent::getEventType).toList());

        outboxService.markPublished(publishable.get(0).getId());

        List<OutboxEvent> remaining = outboxService.findPublishableEvents(5, 10);
        assertEquals(1, remaining.size());
        assertEquals(TransferCommittedEvent.EVENT_TYPE, remaining.get(0).getEventType());
    }

    @Test
    @DisplayName("Event failing too often becomes a dead letter")
    void testDeadLetter() {
        printTestHeader("Dead Letter");
        UUID transferId = UUID.randomUUID();
        transactionTemplate.executeWithoutResult(status -> outboxService.saveEvent(
                "Transfer", transferId, TransferCommittedEvent.EVENT_TYPE, committed(transferId)));
        UUID eventId = outboxService.getEventsForAggregate("Transfer", transferId).get(0).getId();

        for (int i = 0; i < 3; i++) {
            outboxService.markFailed(eventId, "broker down");
        }

        OutboxEvent event = outboxService.getEventsForAggregate("Transfer", transferId).get(0);
        printOutput("Event", event);
        assertEquals(3, event.getRetryCount());
        assertEquals("broker down", event.getLastError());
        assertTrue(outboxService.findPublishableEvents(3, 10).isEmpty());
        assertEquals(1, outboxService.findPublishableEvents(5, 10).size());
        assertEquals(1, repository.countDeadLettered(3));
        printSuccess("Dead letter no longer polled");
    }

    private static TransferCommittedEvent committed(UUID transferId) {
        return TransferCommittedEvent.fromTransfer(Transfer.initiate(
                transferId, "BANKAA", "BANKBB", UUID.randomUUID(), UUID.randomUUID(), 500).prepare().commit());
    }
}
