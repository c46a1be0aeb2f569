package com.eshop.ordering.command;

/**
 * A command kept losing concurrency races and ran out of attempts.
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
