package com.flagship.toy_banking.transfer;

import lombok.Value;

/**
 * The transfer after initiation and whether this call created it (false when an existing
 * transfer was found by id or idempotency key).
 */
@Value
public class InitiationResult {
    Transfer transfer;
    boolean created;
}
