package com.eshop.ordering.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Order line. Owned by {@link Order}; only the aggregate creates or changes lines,
 * after it has validated the input.
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    public static final int MAX_PRODUCT_NAME_LENGTH = 200;
    public static final int MAX_PICTURE_URL_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false)
    private long productId;

    @Column(name = "product_name", nullable = false, length = MAX_PRODUCT_NAME_LENGTH)
    private String productName;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "discount", nullable = false, precision = 12, scale = 2)
    private BigDecimal discount;

    @Column(name = "picture_url", length = MAX_PICTURE_URL_LENGTH)
    private String pictureUrl;

    @Column(name = "units", nullable = false)
    private int units;

    OrderItem(long productId, String productName, BigDecimal unitPrice, BigDecimal discount,
              String pictureUrl, int units) {
        this.productId = productId;
        this.productName = productName;
        this.unitPrice = unitPrice;
        this.discount = discount;
        this.pictureUrl = pictureUrl;
        this.units = units;
    }

    /** Units are the already-summed total; the aggregate checked them for overflow. */
    void merge(int mergedUnits, BigDecimal newDiscount) {
        this.units = mergedUnits;
        this.discount = newDiscount;
    }

    public BigDecimal getLineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(units)).subtract(discount);
    }
}
