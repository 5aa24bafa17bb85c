package com.flagship.toy_banking.transfer.event;

import com.flagship.toy_banking.transfer.Transfer;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TransferInitiatedEvent implements TransferEvent {
    UUID eventId;
    UUID transferId;
    String originId;
    String destinationId;
    UUID sourceAccountId;
    UUID destinationAccountId;
    long amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferInitiated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferInitiatedEvent fromTransfer(Transfer transfer) {
        return new TransferInitiatedEvent(
            UUID.randomUUID(),
            transfer.getId(),
            transfer.getOriginId(),
            transfer.getDestinationId(),
            transfer.getSourceAccountId(),
            transfer.getDestinationAccountId(),
            transfer.getAmount(),
            Instant.now()
        );
    }
}
