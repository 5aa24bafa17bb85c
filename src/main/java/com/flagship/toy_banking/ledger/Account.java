package com.flagship.toy_banking.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an Account.
 * Amounts are minor currency units. Invariant: 0 <= reserved <= balance.
 */
@Value
public class Account {
    UUID id;
    String accountNumber;
    String ownerName;
    AccountState state;
    long balance;
    long reserved;
    long version;
    Instant createdAt;

    public long available() {
        return balance - reserved;
    }

    public boolean isActive() {
        return state == AccountState.ACTIVE;
    }
}
