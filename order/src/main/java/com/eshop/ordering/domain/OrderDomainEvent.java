package com.eshop.ordering.domain;

import java.util.List;

/**
 * Facts staged by the {@link Order} aggregate. In-process only: the unit of work
 * pulls them on commit and turns them into outbox rows.
 */
public sealed interface OrderDomainEvent {

    String orderId();

    String buyerId();

    record OrderStarted(String orderId, String buyerId, String buyerName) implements OrderDomainEvent {
    }

    record OrderStatusChangedToAwaitingValidation(String orderId, String buyerId, List<OrderStockItem> stockItems)
            implements OrderDomainEvent {
    }

    record OrderStockConfirmed(String orderId, String buyerId) implements OrderDomainEvent {
    }

    record OrderStockRejected(String orderId, String buyerId, List<Long> rejectedProductIds)
            implements OrderDomainEvent {
    }

    record OrderPaid(String orderId, String buyerId, List<OrderStockItem> stockItems) implements OrderDomainEvent {
    }

    record OrderShipped(String orderId, String buyerId) implements OrderDomainEvent {
    }

    record OrderCancelled(String orderId, String buyerId, String reason) implements OrderDomainEvent {
    }
}
