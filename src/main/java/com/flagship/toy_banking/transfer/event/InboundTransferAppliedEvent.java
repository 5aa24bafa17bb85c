package com.flagship.toy_banking.transfer.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published by the destination when an inbound transfer is credited.
 */
@Value
public class InboundTransferAppliedEvent implements TransferEvent {
    UUID eventId;
    UUID transferId;
    String originId;
    UUID accountId;
    long amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InboundTransferApplied";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InboundTransferAppliedEvent of(UUID transferId, String originId, UUID accountId, long amount) {
        return new InboundTransferAppliedEvent(UUID.randomUUID(), transferId, originId, accountId, amount, Instant.now());
    }
}
