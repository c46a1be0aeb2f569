package com.eshop.ordering.command;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

public record CreateOrderCommand(
        String buyerId,
        String buyerName,
        ShippingAddress address,
        Card card,
        List<Item> items,
        String requestId
) implements OrderCommand {

    public record ShippingAddress(String street, String city, String state, String country, String zipCode) {
    }

    public record Card(String cardType, String cardNumber, String cardHolderName, YearMonth expiration) {
    }

    public record Item(long productId, String productName, BigDecimal unitPrice, BigDecimal discount,
                       String pictureUrl, int units) {
    }
}
