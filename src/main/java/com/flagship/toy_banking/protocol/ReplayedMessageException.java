package com.flagship.toy_banking.protocol;

/**
 * A (sender, nonce, transfer id) triple arrived again with a different content.
 */
public class ReplayedMessageException extends RuntimeException {

    public ReplayedMessageException(String message) {
        super(message);
    }
}
