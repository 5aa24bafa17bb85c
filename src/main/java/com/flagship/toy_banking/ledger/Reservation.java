package com.flagship.toy_banking.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A hold on an account for one transfer. At most one per (transferId, direction).
 * expiresAt is only set on CREDIT holds.
 */
@Value
public class Reservation {
    UUID transferId;
    ReservationDirection direction;
    UUID accountId;
    long amount;
    Instant expiresAt;
    Instant createdAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
