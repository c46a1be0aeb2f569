package com.eshop.ordering.domain;

/** Product and quantity pair carried by stock-related events. */
public record OrderStockItem(long productId, int units) {
}
