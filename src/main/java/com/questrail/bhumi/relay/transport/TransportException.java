package com.questrail.bhumi.relay.transport;

/**
 * Unrecoverable transport failure, such as a listening socket that cannot be bound.
 */
public final class TransportException extends RuntimeException {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
