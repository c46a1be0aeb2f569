package com.eshop.ordering.domain;

/**
 * Order lifecycle.
 *
 * Normal flow: SUBMITTED → AWAITING_VALIDATION → STOCK_CONFIRMED → PAID → SHIPPED
 * Cancellation: from any state except PAID, SHIPPED and CANCELLED.
 * Stock rejection ends in CANCELLED; the reason is kept in the order description.
 *
 * Transitions not listed in {@link #permits} do not exist.
 */
public enum OrderStatus {

    SUBMITTED,
    AWAITING_VALIDATION,
    STOCK_CONFIRMED,
    PAID,
    SHIPPED,
    CANCELLED;

    public boolean permits(OrderTransition transition) {
        return switch (transition) {
            case SUBMIT -> false;
            case ADD_ORDER_ITEM, SET_AWAITING_VALIDATION -> this == SUBMITTED;
            case SET_STOCK_CONFIRMED, SET_STOCK_REJECTED -> this == AWAITING_VALIDATION;
            case SET_PAID -> this == STOCK_CONFIRMED;
            case SET_SHIPPED -> this == PAID;
            case SET_CANCELLED -> this != PAID && this != SHIPPED && this != CANCELLED;
        };
    }

    public boolean isTerminal() {
        return this == SHIPPED || this == CANCELLED;
    }
}
