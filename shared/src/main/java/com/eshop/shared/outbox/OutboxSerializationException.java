package com.eshop.shared.outbox;

/**
 * An integration event could not be turned into JSON. This is a programming
 * error, never a transient condition, so it aborts the surrounding transaction.
 */
public class OutboxSerializationException extends RuntimeException {

    public OutboxSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
