package com.flagship.toy_banking.participant;

import com.flagship.toy_banking.protocol.ParticipantState;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Destination-side record of an inbound transfer.
 *
 * Transitions:
 * - RESERVED -> APPLIED (commit) or RELEASED (abort, expiry)
 * - REJECTED and RELEASED are final; APPLIED is final
 *
 * A RELEASED record without account and amount is a tombstone left by an ABORT that
 * arrived before any PREPARE.
 */
@Value
public class ParticipantTransfer {
    UUID transferId;
    String originId;
    UUID accountId;
    Long amount;
    ParticipantState state;
    String reason;
    Instant expiresAt;
    Instant createdAt;
    Instant updatedAt;

    public static ParticipantTransfer reserved(UUID transferId, String originId, UUID accountId,
                                               long amount, Instant expiresAt) {
        Instant now = Instant.now();
        return new ParticipantTransfer(transferId, originId, accountId, amount,
            ParticipantState.RESERVED, null, expiresAt, now, now);
    }

    public static ParticipantTransfer rejected(UUID transferId, String originId, UUID accountId,
                                               Long amount, String reason) {
        Instant now = Instant.now();
        return new ParticipantTransfer(transferId, originId, accountId, amount,
            ParticipantState.REJECTED, reason, null, now, now);
    }

    public static ParticipantTransfer tombstone(UUID transferId, String originId) {
        Instant now = Instant.now();
        return new ParticipantTransfer(transferId, originId, null, null,
            ParticipantState.RELEASED, "Aborted before prepare", null, now, now);
    }

    public ParticipantTransfer apply() {
        requireReserved("apply");
        return withState(ParticipantState.APPLIED, null);
    }

    public ParticipantTransfer release(String reason) {
        requireReserved("release");
        return withState(ParticipantState.RELEASED, reason);
    }

    /**
     * True when a PREPARE carries exactly the terms this record was created with.
     */
    public boolean matches(String originId, UUID accountId, Long amount) {
        return this.originId.equals(originId)
            && this.accountId != null && this.accountId.equals(accountId)
            && this.amount != null && this.amount.equals(amount);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    private void requireReserved(String action) {
        if (state != ParticipantState.RESERVED) {
            throw new IllegalStateException(
                String.format("Cannot %s transfer %s in %s state", action, transferId, state));
        }
    }

    private ParticipantTransfer withState(ParticipantState newState, String newReason) {
        return new ParticipantTransfer(transferId, originId, accountId, amount,
            newState, newReason, expiresAt, createdAt, Instant.now());
    }
}
