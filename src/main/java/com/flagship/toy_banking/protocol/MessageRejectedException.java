package com.flagship.toy_banking.protocol;

import lombok.Getter;

/**
 * The remote participant refused the envelope itself (bad signature or replay), as opposed
 * to answering it with a NACK.
 */
@Getter
public class MessageRejectedException extends RuntimeException {

    private final int statusCode;

    public MessageRejectedException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
}
