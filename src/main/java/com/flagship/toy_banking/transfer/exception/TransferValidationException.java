package com.flagship.toy_banking.transfer.exception;

/**
 * Malformed transfer request. Raised before any state is written.
 */
public class TransferValidationException extends IllegalArgumentException {

    public TransferValidationException(String message) {
        super(message);
    }
}
