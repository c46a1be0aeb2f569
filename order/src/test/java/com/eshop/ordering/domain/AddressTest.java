package com.eshop.ordering.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressTest {

    @Test
    @DisplayName("of — trims fields and compares by value")
    void ofTrimsAndComparesByValue() {
        Address a = Address.of(" 1 Main St ", "Seattle", "WA", "US", "98101 ");
        Address b = Address.of("1 Main St", "Seattle", "WA", "US", "98101");

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.getStreet()).isEqualTo("1 Main St");
        assertThat(a.getZipCode()).isEqualTo("98101");
    }

    @Test
    @DisplayName("of — blank field is a validation error naming the field")
    void ofRejectsBlankField() {
        assertThatThrownBy(() -> Address.of("1 Main St", "", "WA", "US", "98101"))
                .isInstanceOf(OrderDomainException.class)
                .hasMessageContaining("city")
                .extracting(e -> ((OrderDomainException) e).getKind())
                .isEqualTo(OrderErrorKind.VALIDATION);
    }

    @Test
    @DisplayName("of — field wider than its column is a validation error")
    void ofRejectsOverlongField() {
        assertThatThrownBy(() -> Address.of("1 Main St", "Seattle", "WA", "US", "9".repeat(21)))
                .isInstanceOf(OrderDomainException.class)
                .hasMessageContaining("zipCode exceeds 20 characters");
        assertThatThrownBy(() -> Address.of("s".repeat(201), "Seattle", "WA", "US", "98101"))
                .isInstanceOf(OrderDomainException.class)
                .hasMessageContaining("street exceeds 200 characters");
    }
}
