package com.eshop.ordering.domain;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Order aggregate root, write model.
 *
 * All state changes go through the guarded methods below. A method either
 * succeeds, changes the status and stages exactly one {@link OrderDomainEvent},
 * or throws {@link OrderDomainException} and leaves the order untouched.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_buyer_id", columnList = "buyer_id"),
    @Index(name = "idx_orders_status_order_date", columnList = "status, order_date")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order {

    public static final String AGGREGATE_TYPE = "Order";
    public static final int MAX_ORDER_ITEMS = 100;
    public static final int MAX_BUYER_ID_LENGTH = 50;
    public static final int MAX_BUYER_NAME_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    @Id
    @Column(name = "id", length = 20)
    private String id;

    @Column(name = "buyer_id", nullable = false, length = MAX_BUYER_ID_LENGTH)
    private String buyerId;

    @Column(name = "buyer_name", nullable = false, length = MAX_BUYER_NAME_LENGTH)
    private String buyerName;

    @Embedded
    private Address address;

    @Embedded
    private PaymentCard paymentCard;

    @Column(name = "order_date", nullable = false, updatable = false)
    private Instant orderDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private OrderStatus status;

    @Column(name = "description", length = MAX_DESCRIPTION_LENGTH)
    private String description;

    @Getter(AccessLevel.NONE)
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @OrderBy("id ASC")
    private List<OrderItem> orderItems = new ArrayList<>();

    /** Optimistic locking, second line of defence behind the row lock */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Getter(AccessLevel.NONE)
    @Transient
    private List<OrderDomainEvent> domainEvents = new ArrayList<>();

    public Order(String buyerId, String buyerName, Address address, PaymentCard paymentCard, Instant orderDate) {
        if (buyerId == null || buyerId.isBlank()) {
            throw rejectSubmit("Buyer id is required");
        }
        if (buyerId.length() > MAX_BUYER_ID_LENGTH) {
            throw rejectSubmit("Buyer id exceeds " + MAX_BUYER_ID_LENGTH + " characters");
        }
        if (buyerName == null || buyerName.isBlank()) {
            throw rejectSubmit("Buyer name is required");
        }
        if (buyerName.length() > MAX_BUYER_NAME_LENGTH) {
            throw rejectSubmit("Buyer name exceeds " + MAX_BUYER_NAME_LENGTH + " characters");
        }
        if (address == null) {
            throw rejectSubmit("Shipping address is required");
        }
        if (paymentCard == null) {
            throw rejectSubmit("Payment card is required");
        }
        this.id = newOrderId();
        this.buyerId = buyerId;
        this.buyerName = buyerName;
        this.address = address;
        this.paymentCard = paymentCard;
        this.orderDate = Objects.requireNonNull(orderDate, "orderDate");
        this.status = OrderStatus.SUBMITTED;
        this.description = "Order submitted";
        this.updatedAt = this.orderDate;
        stage(new OrderDomainEvent.OrderStarted(id, buyerId, buyerName));
    }

    // ─── Line items ──────────────────────────────────────────────────────────

    /**
     * Adds a line, or merges into the existing line for the same product: units are
     * summed and the higher discount is kept.
     */
    public void addOrderItem(long productId, String productName, BigDecimal unitPrice, BigDecimal discount,
                             String pictureUrl, int units) {
        ensurePermitted(OrderTransition.ADD_ORDER_ITEM);
        if (units <= 0) {
            throw rejectItem("Invalid number of units: " + units);
        }
        if (productName == null || productName.isBlank()) {
            throw rejectItem("Product name is required");
        }
        if (productName.length() > OrderItem.MAX_PRODUCT_NAME_LENGTH) {
            throw rejectItem("Product name exceeds " + OrderItem.MAX_PRODUCT_NAME_LENGTH + " characters");
        }
        if (pictureUrl != null && pictureUrl.length() > OrderItem.MAX_PICTURE_URL_LENGTH) {
            throw rejectItem("Picture URL exceeds " + OrderItem.MAX_PICTURE_URL_LENGTH + " characters");
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw rejectItem("Unit price must not be negative");
        }
        BigDecimal effectiveDiscount = discount == null ? BigDecimal.ZERO : discount;
        if (effectiveDiscount.signum() < 0) {
            throw rejectItem("Discount must not be negative");
        }

        OrderItem existing = findItem(productId);
        if (existing != null) {
            int mergedUnits;
            try {
                mergedUnits = Math.addExact(existing.getUnits(), units);
            } catch (ArithmeticException e) {
                throw rejectItem("Too many units for product " + productId);
            }
            BigDecimal mergedDiscount = existing.getDiscount().max(effectiveDiscount);
            ensureDiscountCovered(productId, existing.getUnitPrice(), mergedDiscount, mergedUnits);
            existing.merge(mergedUnits, mergedDiscount);
            return;
        }
        if (orderItems.size() >= MAX_ORDER_ITEMS) {
            throw rejectItem("An order holds at most " + MAX_ORDER_ITEMS + " lines");
        }
        ensureDiscountCovered(productId, unitPrice, effectiveDiscount, units);
        orderItems.add(new OrderItem(productId, productName, unitPrice, effectiveDiscount, pictureUrl, units));
    }

    public List<OrderItem> getOrderItems() {
        return List.copyOf(orderItems);
    }

    public BigDecimal getTotal() {
        return orderItems.stream()
            .map(OrderItem::getLineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    // ─── Status transitions ──────────────────────────────────────────────────

    public void setAwaitingValidationStatus() {
        ensurePermitted(OrderTransition.SET_AWAITING_VALIDATION);
        status = OrderStatus.AWAITING_VALIDATION;
        description = "Awaiting stock validation";
        stage(new OrderDomainEvent.OrderStatusChangedToAwaitingValidation(id, buyerId, stockItems()));
    }

    public void setStockConfirmedStatus() {
        ensurePermitted(OrderTransition.SET_STOCK_CONFIRMED);
        status = OrderStatus.STOCK_CONFIRMED;
        description = "All the items were confirmed with available stock";
        stage(new OrderDomainEvent.OrderStockConfirmed(id, buyerId));
    }

    public void setStockRejectedStatus(List<Long> rejectedProductIds) {
        ensurePermitted(OrderTransition.SET_STOCK_REJECTED);
        if (rejectedProductIds == null || rejectedProductIds.isEmpty()) {
            throw new OrderDomainException(OrderError.validation(id, OrderTransition.SET_STOCK_REJECTED, status,
                    "At least one rejected product id is required"));
        }
        List<Long> rejected = List.copyOf(rejectedProductIds);
        String rejectedNames = orderItems.stream()
            .filter(item -> rejected.contains(item.getProductId()))
            .map(OrderItem::getProductName)
            .collect(Collectors.joining(", "));
        status = OrderStatus.CANCELLED;
        description = abbreviate("The product items don't have stock: "
            + (rejectedNames.isEmpty() ? rejected.toString() : rejectedNames));
        stage(new OrderDomainEvent.OrderStockRejected(id, buyerId, rejected));
    }

    public void setPaidStatus() {
        ensurePermitted(OrderTransition.SET_PAID);
        status = OrderStatus.PAID;
        description = "The payment was performed";
        stage(new OrderDomainEvent.OrderPaid(id, buyerId, stockItems()));
    }

    public void setShippedStatus() {
        ensurePermitted(OrderTransition.SET_SHIPPED);
        status = OrderStatus.SHIPPED;
        description = "The order was shipped";
        stage(new OrderDomainEvent.OrderShipped(id, buyerId));
    }

    public void setCancelledStatus() {
        setCancelledStatus("The order was cancelled");
    }

    public void setCancelledStatus(String reason) {
        ensurePermitted(OrderTransition.SET_CANCELLED);
        String effectiveReason = reason == null || reason.isBlank() ? "The order was cancelled" : reason;
        if (effectiveReason.length() > MAX_DESCRIPTION_LENGTH) {
            throw new OrderDomainException(OrderError.validation(id, OrderTransition.SET_CANCELLED, status,
                    "Cancellation reason exceeds " + MAX_DESCRIPTION_LENGTH + " characters"));
        }
        status = OrderStatus.CANCELLED;
        description = effectiveReason;
        stage(new OrderDomainEvent.OrderCancelled(id, buyerId, effectiveReason));
    }

    // ─── Domain events ───────────────────────────────────────────────────────

    /** Returns the staged events and clears them. */
    public List<OrderDomainEvent> pullDomainEvents() {
        List<OrderDomainEvent> pulled = List.copyOf(domainEvents);
        domainEvents.clear();
        return pulled;
    }

    public List<OrderDomainEvent> getDomainEvents() {
        return List.copyOf(domainEvents);
    }

    /** Stamps the time of the change being committed. */
    public void touch(Instant now) {
        updatedAt = Objects.requireNonNull(now, "now");
    }

    // ─── Helpers ─────────────────────────────────────────────────────────────

    private void ensurePermitted(OrderTransition transition) {
        if (!status.permits(transition)) {
            throw new OrderDomainException(OrderError.invalidTransition(id, transition, status));
        }
    }

    private void ensureDiscountCovered(long productId, BigDecimal unitPrice, BigDecimal discount, int units) {
        BigDecimal lineTotal = unitPrice.multiply(BigDecimal.valueOf(units));
        if (discount.compareTo(lineTotal) > 0) {
            throw rejectItem("Discount " + discount + " exceeds line total " + lineTotal + " for product " + productId);
        }
    }

    private OrderItem findItem(long productId) {
        for (OrderItem item : orderItems) {
            if (item.getProductId() == productId) {
                return item;
            }
        }
        return null;
    }

    private List<OrderStockItem> stockItems() {
        return orderItems.stream()
            .map(item -> new OrderStockItem(item.getProductId(), item.getUnits()))
            .toList();
    }

    private void stage(OrderDomainEvent event) {
        domainEvents.add(event);
    }

    /** Cuts text to the description column width. */
    private static String abbreviate(String text) {
        if (text.length() <= MAX_DESCRIPTION_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_DESCRIPTION_LENGTH - 3) + "...";
    }

    private OrderDomainException rejectItem(String message) {
        return new OrderDomainException(OrderError.validation(id, OrderTransition.ADD_ORDER_ITEM, status, message));
    }

    private static OrderDomainException rejectSubmit(String message) {
        return new OrderDomainException(OrderError.validation(null, OrderTransition.SUBMIT, null, message));
    }

    private static String newOrderId() {
        return "ord_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
