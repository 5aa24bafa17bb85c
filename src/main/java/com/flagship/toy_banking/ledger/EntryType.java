package com.flagship.toy_banking.ledger;

/**
 * Type of ledger entry.
 * DEBIT: money leaves the account
 * CREDIT: money enters the account
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
