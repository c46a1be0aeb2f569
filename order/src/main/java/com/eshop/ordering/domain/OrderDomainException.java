package com.eshop.ordering.domain;

import lombok.Getter;

/**
 * Raised by the aggregate when an operation breaks an order rule. Command
 * handlers turn it into a {@code Rejected} result after rolling back.
 */
@Getter
public class OrderDomainException extends RuntimeException {

    private final OrderError error;

    public OrderDomainException(OrderError error) {
        super(error.message());
        this.error = error;
    }

    public OrderErrorKind getKind() {
        return error.kind();
    }
}
