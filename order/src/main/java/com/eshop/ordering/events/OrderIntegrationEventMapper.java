package com.eshop.ordering.events;

import com.eshop.ordering.domain.OrderDomainEvent;
import com.eshop.ordering.domain.OrderStatus;
import com.eshop.ordering.events.OrderIntegrationEvent.OrderAwaitingValidationEvent;
import com.eshop.ordering.events.OrderIntegrationEvent.OrderCancelledEvent;
import com.eshop.ordering.events.OrderIntegrationEvent.OrderPaidEvent;
import com.eshop.ordering.events.OrderIntegrationEvent.OrderShippedEvent;
import com.eshop.ordering.events.OrderIntegrationEvent.OrderStartedEvent;
import com.eshop.ordering.events.OrderIntegrationEvent.OrderStockConfirmedEvent;
import com.eshop.ordering.events.OrderIntegrationEvent.OrderStockRejectedEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event → integration event. One domain event yields exactly one
 * integration event with a fresh event id.
 */
public final class OrderIntegrationEventMapper {

    private OrderIntegrationEventMapper() {}

    public static OrderIntegrationEvent toIntegrationEvent(OrderDomainEvent event, Instant occurredAt) {
        String eventId = UUID.randomUUID().toString();

        if (event instanceof OrderDomainEvent.OrderStarted e) {
            return new OrderStartedEvent(eventId, occurredAt, e.orderId(), e.buyerId(), e.buyerName(),
                    OrderStatus.SUBMITTED);
        }
        if (event instanceof OrderDomainEvent.OrderStatusChangedToAwaitingValidation e) {
            return new OrderAwaitingValidationEvent(eventId, occurredAt, e.orderId(), e.buyerId(),
                    OrderStatus.AWAITING_VALIDATION, e.stockItems());
        }
        if (event instanceof OrderDomainEvent.OrderStockConfirmed e) {
            return new OrderStockConfirmedEvent(eventId, occurredAt, e.orderId(), e.buyerId(),
                    OrderStatus.STOCK_CONFIRMED);
        }
        if (event instanceof OrderDomainEvent.OrderStockRejected e) {
            return new OrderStockRejectedEvent(eventId, occurredAt, e.orderId(), e.buyerId(),
                    OrderStatus.CANCELLED, e.rejectedProductIds());
        }
        if (event instanceof OrderDomainEvent.OrderPaid e) {
            return new OrderPaidEvent(eventId, occurredAt, e.orderId(), e.buyerId(), OrderStatus.PAID,
                    e.stockItems());
        }
        if (event instanceof OrderDomainEvent.OrderShipped e) {
            return new OrderShippedEvent(eventId, occurredAt, e.orderId(), e.buyerId(), OrderStatus.SHIPPED);
        }
        if (event instanceof OrderDomainEvent.OrderCancelled e) {
            return new OrderCancelledEvent(eventId, occurredAt, e.orderId(), e.buyerId(), OrderStatus.CANCELLED,
                    e.reason());
        }
        throw new IllegalArgumentException("No integration event for " + event.getClass().getName());
    }
}
