package com.eshop.ordering.command;

import com.eshop.ordering.domain.OrderError;
import com.eshop.ordering.domain.OrderStatus;

/**
 * What a command handler returns. Rule violations come back as {@link Rejected};
 * infrastructure failures are thrown.
 */
public sealed interface OrderCommandResult {

    /**
     * @param replayed true when the idempotency token had already been processed and
     *                 the stored outcome is returned without re-executing
     */
    record Accepted(String orderId, OrderStatus status, boolean replayed) implements OrderCommandResult {
    }

    record Rejected(OrderError error) implements OrderCommandResult {
    }

    default boolean isAccepted() {
        return this instanceof Accepted;
    }
}
