package com.eshop.ordering.domain;

/**
 * A rejected order operation: what was attempted, on which order, and the status
 * that blocked it. {@code transition} and {@code currentStatus} are null when they
 * do not apply (e.g. the order does not exist).
 */
public record OrderError(
        OrderErrorKind kind,
        String orderId,
        OrderTransition transition,
        OrderStatus currentStatus,
        String message
) {

    public static OrderError invalidTransition(String orderId, OrderTransition transition, OrderStatus currentStatus) {
        return new OrderError(OrderErrorKind.INVALID_TRANSITION, orderId, transition, currentStatus,
                String.format("Cannot %s order %s: current status is %s", transition, orderId, currentStatus));
    }

    public static OrderError validation(String orderId, OrderTransition transition, OrderStatus currentStatus,
                                        String message) {
        return new OrderError(OrderErrorKind.VALIDATION, orderId, transition, currentStatus, message);
    }

    public static OrderError notFound(String orderId) {
        return new OrderError(OrderErrorKind.ORDER_NOT_FOUND, orderId, null, null, "Order not found: " + orderId);
    }

    public static OrderError concurrencyConflict(String orderId, OrderTransition transition) {
        return new OrderError(OrderErrorKind.CONCURRENCY_CONFLICT, orderId, transition, null,
                "Order " + orderId + " was modified concurrently, retry later");
    }
}
