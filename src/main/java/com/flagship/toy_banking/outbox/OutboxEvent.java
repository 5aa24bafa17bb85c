package com.flagship.toy_banking.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox to be published to Kafka.
 * Written in the same database transaction as the state change it describes.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Transfer" or "ParticipantTransfer"
    UUID aggregateId;          // transfer id
    String eventType;          // e.g. "TransferCommitted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
