package com.eshop.ordering.query;

import com.eshop.shared.outbox.OutboxRecord;
import com.eshop.shared.outbox.OutboxStatus;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

/**
 * One entry of an order's event history, with its delivery state.
 */
public record OrderEventView(
        String eventId,
        String eventType,
        long sequence,
        OutboxStatus deliveryStatus,
        int attempts,
        String lastError,
        Instant createdAt,
        Instant publishedAt,
        @JsonRawValue String payload
) {

    public static OrderEventView from(OutboxRecord record) {
        return new OrderEventView(
                record.getId(),
                record.getEventType(),
                record.getSequence(),
                record.getStatus(),
                record.getAttempts(),
                record.getLastError(),
                record.getCreatedAt(),
                record.getPublishedAt(),
                record.getPayload()
        );
    }
}
