package com.flagship.toy_banking.transfer.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of the events published on the transfers topic.
 */
public interface TransferEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getTransferId();

    Instant getOccurredAt();

    String getEventType();
}
