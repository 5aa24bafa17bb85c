package com.flagship.toy_banking.protocol;

public enum MessageType {
    PREPARE,
    COMMIT,
    ABORT,
    QUERY,
    ACK,
    NACK;

    public boolean isReply() {
        return this == ACK || this == NACK;
    }
}
