package com.eshop.ordering.command;

/**
 * A caller's request to change an order.
 */
public interface OrderCommand {

    /** Client-supplied idempotency token; null when the caller does not need replay protection. */
    String requestId();
}
