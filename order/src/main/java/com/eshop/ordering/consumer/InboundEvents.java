package com.eshop.ordering.consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Payloads of the integration events this service consumes. Only the fields
 * ordering needs are mapped; anything else in the message is ignored.
 */
public final class InboundEvents {

    private InboundEvents() {}

    // ─── Inventory Events ─────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StockConfirmedEvent(String eventId, String orderId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StockRejectedEvent(String eventId, String orderId, List<Long> rejectedProductIds) {
    }

    // ─── Payment Events ───────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentSucceededEvent(String eventId, String orderId, String paymentId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentFailedEvent(String eventId, String orderId, String reason) {
    }
}
