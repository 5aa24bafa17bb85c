package com.flagship.toy_banking.ledger;

/**
 * The ledger database cannot be reached. Nothing was changed by the failed operation.
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
