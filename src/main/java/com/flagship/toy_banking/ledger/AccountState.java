package com.flagship.toy_banking.ledger;

public enum AccountState {
    ACTIVE,
    CANCELED
}
