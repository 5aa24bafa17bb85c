package com.flagship.toy_banking.transfer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Transfer domain object, owned by the origin instance.
 *
 * State changes return a new instance. Applying the status the transfer already has
 * returns it unchanged; any other transition out of a terminal status is rejected.
 */
@Value
public class Transfer {
    UUID id;
    String originId;
    String destinationId;
    UUID sourceAccountId;
    UUID destinationAccountId;
    long amount;
    TransferStatus status;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    public static Transfer initiate(UUID id, String originId, String destinationId,
                                    UUID sourceAccountId, UUID destinationAccountId, long amount) {
        Instant now = Instant.now();
        return new Transfer(
            id,
            originId,
            destinationId,
            sourceAccountId,
            destinationAccountId,
            amount,
            TransferStatus.INITIATED,
            null,
            now,
            now
        );
    }

    /**
     * The destination acknowledged PREPARE and holds the credit.
     *
     * @throws IllegalStateException unless INITIATED or already PREPARED
     */
    public Transfer prepare() {
        if (status == TransferStatus.PREPARED) {
            return this;
        }
        requireStatus(TransferStatus.PREPARED, TransferStatus.INITIATED);
        return withStatus(TransferStatus.PREPARED, failureReason);
    }

    /**
     * @throws IllegalStateException unless PREPARED or already COMMITTED
     */
    public Transfer commit() {
        if (status == TransferStatus.COMMITTED) {
            return this;
        }
        requireStatus(TransferStatus.COMMITTED, TransferStatus.PREPARED);
        return withStatus(TransferStatus.COMMITTED, null);
    }

    /**
     * @throws IllegalStateException if the transfer is COMMITTED
     */
    public Transfer abort(String reason) {
        if (status == TransferStatus.ABORTED) {
            return this;
        }
        requireStatus(TransferStatus.ABORTED, TransferStatus.INITIATED, TransferStatus.PREPARED);
        return withStatus(TransferStatus.ABORTED, reason);
    }

    public boolean isTerminal() {
        return status == TransferStatus.COMMITTED || status == TransferStatus.ABORTED;
    }

    private void requireStatus(TransferStatus target, TransferStatus... allowed) {
        for (TransferStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new IllegalStateException(
            String.format("Cannot move transfer %s from %s to %s", id, status, target));
    }

    private Transfer withStatus(TransferStatus newStatus, String reason) {
        return new Transfer(
            id,
            originId,
            destinationId,
            sourceAccountId,
            destinationAccountId,
            amount,
            newStatus,
            reason,
            createdAt,
            Instant.now()
        );
    }
}
