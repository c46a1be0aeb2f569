package com.eshop.ordering.events;

import com.eshop.ordering.domain.OrderStatus;
import com.eshop.ordering.domain.OrderStockItem;
import com.eshop.shared.events.EventTypes;
import com.eshop.shared.events.IntegrationEvent;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Integration events the ordering service announces. Payloads carry the event id,
 * occurrence time, order id, buyer id, resulting status and the minimal extra
 * data downstream services need.
 *
 * Naming: {Noun}{PastTense}Event, e.g. OrderPaidEvent
 */
public sealed interface OrderIntegrationEvent extends IntegrationEvent {

    String orderId();

    String buyerId();

    OrderStatus orderStatus();

    @JsonIgnore
    @Override
    default String aggregateId() {
        return orderId();
    }

    record OrderStartedEvent(String eventId, Instant occurredAt, String orderId, String buyerId,
                             String buyerName, OrderStatus orderStatus) implements OrderIntegrationEvent {
        @Override
        public String type() {
            return EventTypes.ORDER_STARTED;
        }
    }

    record OrderAwaitingValidationEvent(String eventId, Instant occurredAt, String orderId, String buyerId,
                                        OrderStatus orderStatus, List<OrderStockItem> stockItems)
            implements OrderIntegrationEvent {
        @Override
        public String type() {
            return EventTypes.ORDER_AWAITING_VALIDATION;
        }
    }

    record OrderStockConfirmedEvent(String eventId, Instant occurredAt, String orderId, String buyerId,
                                    OrderStatus orderStatus) implements OrderIntegrationEvent {
        @Override
        public String type() {
            return EventTypes.ORDER_STOCK_CONFIRMED;
        }
    }

    record OrderStockRejectedEvent(String eventId, Instant occurredAt, String orderId, String buyerId,
                                   OrderStatus orderStatus, List<Long> rejectedProductIds)
            implements OrderIntegrationEvent {
        @Override
        public String type() {
            return EventTypes.ORDER_STOCK_REJECTED;
        }
    }

    record OrderPaidEvent(String eventId, Instant occurredAt, String orderId, String buyerId,
                          OrderStatus orderStatus, List<OrderStockItem> stockItems)
            implements OrderIntegrationEvent {
        @Override
        public String type() {
            return EventTypes.ORDER_PAID;
        }
    }

    record OrderShippedEvent(String eventId, Instant occurredAt, String orderId, String buyerId,
                             OrderStatus orderStatus) implements OrderIntegrationEvent {
        @Override
        public String type() {
            return EventTypes.ORDER_SHIPPED;
        }
    }

    record OrderCancelledEvent(String eventId, Instant occurredAt, String orderId, String buyerId,
                               OrderStatus orderStatus, String reason) implements OrderIntegrationEvent {
        @Override
        public String type() {
            return EventTypes.ORDER_CANCELLED;
        }
    }
}
