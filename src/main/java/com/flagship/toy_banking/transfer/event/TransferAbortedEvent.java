package com.flagship.toy_banking.transfer.event;

import com.flagship.toy_banking.transfer.Transfer;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TransferAbortedEvent implements TransferEvent {
    UUID eventId;
    UUID transferId;
    UUID sourceAccountId;
    long amount;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferAborted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferAbortedEvent fromTransfer(Transfer transfer) {
        return new TransferAbortedEvent(
            UUID.randomUUID(),
            transfer.getId(),
            transfer.getSourceAccountId(),
            transfer.getAmount(),
            transfer.getFailureReason(),
            Instant.now()
        );
    }
}
