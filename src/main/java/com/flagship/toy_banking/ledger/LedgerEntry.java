package com.flagship.toy_banking.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a Ledger Entry.
 * Append-only; transferId is null for the initial deposit of an account.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transferId;
    UUID accountId;
    long amount;
    EntryType entryType;
    String description;
    Long sequenceNumber;
    Instant createdAt;
}
