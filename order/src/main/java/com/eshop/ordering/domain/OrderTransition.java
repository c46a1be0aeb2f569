package com.eshop.ordering.domain;

/**
 * Mutations the aggregate accepts; named in every rejection so callers know what was attempted.
 */
public enum OrderTransition {
    SUBMIT,
    ADD_ORDER_ITEM,
    SET_AWAITING_VALIDATION,
    SET_STOCK_CONFIRMED,
    SET_STOCK_REJECTED,
    SET_PAID,
    SET_SHIPPED,
    SET_CANCELLED
}
