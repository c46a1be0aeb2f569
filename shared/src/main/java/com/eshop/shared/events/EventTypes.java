package com.eshop.shared.events;

/**
 * Canonical event type constants.
 * All services MUST use these constants, never hardcoded strings.
 * Changing a type here is a breaking change requiring consumer updates.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Order Domain (produced by the ordering service) ───────────────────────
    public static final String ORDER_STARTED               = "orders.started";
    public static final String ORDER_AWAITING_VALIDATION   = "orders.awaiting-validation";
    public static final String ORDER_STOCK_CONFIRMED       = "orders.stock-confirmed";
    public static final String ORDER_STOCK_REJECTED        = "orders.stock-rejected";
    public static final String ORDER_PAID                  = "orders.paid";
    public static final String ORDER_SHIPPED               = "orders.shipped";
    public static final String ORDER_CANCELLED             = "orders.cancelled";

    // ── Inventory Domain (consumed by the ordering service) ───────────────────
    public static final String INVENTORY_STOCK_CONFIRMED   = "inventory.stock-confirmed";
    public static final String INVENTORY_STOCK_REJECTED    = "inventory.stock-rejected";

    // ── Payment Domain (consumed by the ordering service) ─────────────────────
    public static final String PAYMENT_SUCCEEDED           = "payments.succeeded";
    public static final String PAYMENT_FAILED              = "payments.failed";

    // ── Kafka Topics (same as event types for simplicity) ─────────────────────
    public static final String TOPIC_ORDERS_STARTED             = ORDER_STARTED;
    public static final String TOPIC_ORDERS_AWAITING_VALIDATION = ORDER_AWAITING_VALIDATION;
    public static final String TOPIC_ORDERS_STOCK_CONFIRMED     = ORDER_STOCK_CONFIRMED;
    public static final String TOPIC_ORDERS_STOCK_REJECTED      = ORDER_STOCK_REJECTED;
    public static final String TOPIC_ORDERS_PAID                = ORDER_PAID;
    public static final String TOPIC_ORDERS_SHIPPED             = ORDER_SHIPPED;
    public static final String TOPIC_ORDERS_CANCELLED           = ORDER_CANCELLED;
    public static final String TOPIC_INVENTORY_STOCK_CONFIRMED  = INVENTORY_STOCK_CONFIRMED;
    public static final String TOPIC_INVENTORY_STOCK_REJECTED   = INVENTORY_STOCK_REJECTED;
    public static final String TOPIC_PAYMENTS_SUCCEEDED         = PAYMENT_SUCCEEDED;
    public static final String TOPIC_PAYMENTS_FAILED            = PAYMENT_FAILED;

    // ── Kafka Headers ─────────────────────────────────────────────────────────
    public static final String HEADER_EVENT_ID     = "event-id";
    public static final String HEADER_EVENT_TYPE   = "event-type";
    public static final String HEADER_AGGREGATE_ID = "aggregate-id";
    public static final String HEADER_SEQUENCE     = "sequence";
}
