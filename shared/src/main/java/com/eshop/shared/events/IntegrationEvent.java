package com.eshop.shared.events;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Contract for every message a service announces to the rest of the platform.
 *
 * Every integration event carries:
 *  - eventId:     Globally unique identifier (UUID v4); consumers de-duplicate on it
 *  - occurredAt:  When the state change that produced the event happened
 *  - aggregateId: The aggregate the event belongs to; used as the Kafka partition key
 *
 * The routing metadata (type, topic) is not part of the payload. It travels in
 * the outbox row and in Kafka headers.
 */
public interface IntegrationEvent {

    String eventId();

    Instant occurredAt();

    @JsonIgnore
    String aggregateId();

    /** Hierarchical dot-notation name, e.g. "orders.paid" */
    @JsonIgnore
    String type();

    /** Kafka topic the event is relayed to */
    @JsonIgnore
    default String topic() {
        return type();
    }
}
