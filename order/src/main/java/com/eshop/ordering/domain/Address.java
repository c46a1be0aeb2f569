package com.eshop.ordering.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Shipping address. Immutable value object, compared by value.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Address {

    @Column(name = "address_street", nullable = false, length = 200)
    private String street;

    @Column(name = "address_city", nullable = false, length = 100)
    private String city;

    @Column(name = "address_state", nullable = false, length = 100)
    private String state;

    @Column(name = "address_country", nullable = false, length = 100)
    private String country;

    @Column(name = "address_zip_code", nullable = false, length = 20)
    private String zipCode;

    public static Address of(String street, String city, String state, String country, String zipCode) {
        requireText(street, "street", 200);
        requireText(city, "city", 100);
        requireText(state, "state", 100);
        requireText(country, "country", 100);
        requireText(zipCode, "zipCode", 20);
        return new Address(street.trim(), city.trim(), state.trim(), country.trim(), zipCode.trim());
    }

    private static void requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw invalid("Address " + field + " is required");
        }
        if (value.trim().length() > maxLength) {
            throw invalid("Address " + field + " exceeds " + maxLength + " characters");
        }
    }

    private static OrderDomainException invalid(String message) {
        return new OrderDomainException(OrderError.validation(null, OrderTransition.SUBMIT, null, message));
    }
}
