package com.flagship.toy_banking.protocol;

/**
 * A remote instance or the registry could not be reached, timed out, or answered with a
 * server error. The request may or may not have been processed remotely.
 */
public class RemoteUnreachableException extends RuntimeException {

    public RemoteUnreachableException(String message) {
        super(message);
    }

    public RemoteUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
