package com.flagship.toy_banking.transfer.event;

import com.flagship.toy_banking.transfer.Transfer;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The source account has been debited; the destination reported the credit as applied.
 */
@Value
public class TransferCommittedEvent implements TransferEvent {
    UUID eventId;
    UUID transferId;
    String destinationId;
    UUID sourceAccountId;
    UUID destinationAccountId;
    long amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCommitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferCommittedEvent fromTransfer(Transfer transfer) {
        return new TransferCommittedEvent(
            UUID.randomUUID(),
            transfer.getId(),
            transfer.getDestinationId(),
            transfer.getSourceAccountId(),
            transfer.getDestinationAccountId(),
            transfer.getAmount(),
            Instant.now()
        );
    }
}
