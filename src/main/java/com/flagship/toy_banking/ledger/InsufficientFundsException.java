package com.flagship.toy_banking.ledger;

import lombok.Getter;

import java.util.UUID;

@Getter
public class InsufficientFundsException extends RuntimeException {

    private final UUID accountId;
    private final long requested;
    private final long available;

    public InsufficientFundsException(UUID accountId, long requested, long available) {
        super(String.format("Insufficient funds on account %s: requested=%d, available=%d",
                accountId, requested, available));
        this.accountId = accountId;
        this.requested = requested;
        this.available = available;
    }
}
