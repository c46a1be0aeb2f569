package com.eshop.ordering.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum OrderErrorKind {

    VALIDATION("ORD001", "Order input is invalid"),
    INVALID_TRANSITION("ORD002", "Order status does not allow this operation"),
    ORDER_NOT_FOUND("ORD003", "Order not found"),
    CONCURRENCY_CONFLICT("ORD004", "Order was modified concurrently, retry later");

    private final String code;
    private final String defaultMessage;
}
