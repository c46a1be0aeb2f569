package com.eshop.ordering.query;

import com.eshop.ordering.domain.Address;
import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderItem;
import com.eshop.ordering.domain.OrderStatus;
import com.eshop.ordering.domain.PaymentCard;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read model of an order, cached in Redis as JSON.
 */
public record OrderView(
        String orderId,
        String buyerId,
        String buyerName,
        OrderStatus status,
        String description,
        Instant orderDate,
        ShippingAddress address,
        Card card,
        List<Line> items,
        BigDecimal total,
        Long version,
        Instant updatedAt
) {

    public record ShippingAddress(String street, String city, String state, String country, String zipCode) {
    }

    public record Card(String cardType, String maskedNumber, String cardHolderName, String expiration) {
    }

    public record Line(long productId, String productName, BigDecimal unitPrice, BigDecimal discount,
                       String pictureUrl, int units, BigDecimal lineTotal) {
    }

    public static OrderView from(Order order) {
        Address address = order.getAddress();
        PaymentCard card = order.getPaymentCard();
        return new OrderView(
                order.getId(),
                order.getBuyerId(),
                order.getBuyerName(),
                order.getStatus(),
                order.getDescription(),
                order.getOrderDate(),
                new ShippingAddress(address.getStreet(), address.getCity(), address.getState(),
                        address.getCountry(), address.getZipCode()),
                new Card(card.getCardType(), card.getMaskedNumber(), card.getCardHolderName(), card.getExpiration()),
                order.getOrderItems().stream().map(OrderView::line).toList(),
                order.getTotal(),
                order.getVersion(),
                order.getUpdatedAt()
        );
    }

    private static Line line(OrderItem item) {
        return new Line(item.getProductId(), item.getProductName(), item.getUnitPrice(), item.getDiscount(),
                item.getPictureUrl(), item.getUnits(), item.getLineTotal());
    }
}
