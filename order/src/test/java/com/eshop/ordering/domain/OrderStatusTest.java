package com.eshop.ordering.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusTest {

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"SUBMITTED", "AWAITING_VALIDATION", "STOCK_CONFIRMED"})
    @DisplayName("permits — cancellation allowed before payment")
    void cancelAllowedBeforePayment(OrderStatus status) {
        assertThat(status.permits(OrderTransition.SET_CANCELLED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"PAID", "SHIPPED", "CANCELLED"})
    @DisplayName("permits — cancellation refused once paid or finished")
    void cancelRefusedAfterPayment(OrderStatus status) {
        assertThat(status.permits(OrderTransition.SET_CANCELLED)).isFalse();
    }

    @Test
    @DisplayName("permits — each forward transition has exactly one source status")
    void forwardTransitionsHaveOneSource() {
        assertThat(sources(OrderTransition.SET_AWAITING_VALIDATION)).containsExactly(OrderStatus.SUBMITTED);
        assertThat(sources(OrderTransition.SET_STOCK_CONFIRMED)).containsExactly(OrderStatus.AWAITING_VALIDATION);
        assertThat(sources(OrderTransition.SET_STOCK_REJECTED)).containsExactly(OrderStatus.AWAITING_VALIDATION);
        assertThat(sources(OrderTransition.SET_PAID)).containsExactly(OrderStatus.STOCK_CONFIRMED);
        assertThat(sources(OrderTransition.SET_SHIPPED)).containsExactly(OrderStatus.PAID);
        assertThat(sources(OrderTransition.ADD_ORDER_ITEM)).containsExactly(OrderStatus.SUBMITTED);
    }

    @Test
    @DisplayName("permits — CANCELLED allows nothing")
    void cancelledIsFinal() {
        assertThat(Arrays.stream(OrderTransition.values()).noneMatch(OrderStatus.CANCELLED::permits)).isTrue();
        assertThat(OrderStatus.CANCELLED.isTerminal()).isTrue();
        assertThat(OrderStatus.PAID.isTerminal()).isFalse();
    }

    private static OrderStatus[] sources(OrderTransition transition) {
        return Arrays.stream(OrderStatus.values())
                .filter(status -> status.permits(transition))
                .toArray(OrderStatus[]::new);
    }
}
