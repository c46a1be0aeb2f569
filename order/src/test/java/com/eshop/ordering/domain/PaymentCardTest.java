package com.eshop.ordering.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentCardTest {

    private static final YearMonth MARCH_2024 = YearMonth.of(2024, 3);

    @Test
    @DisplayName("of — keeps only the last four digits")
    void ofMasksNumber() {
        PaymentCard card = PaymentCard.of("Visa", "4111-1111 1111-4242", "Alice", YearMonth.of(2026, 1), MARCH_2024);

        assertThat(card.getMaskedNumber()).isEqualTo("************4242");
        assertThat(card.getLastFourDigits()).isEqualTo("4242");
        assertThat(card.toString()).doesNotContain("41111111");
        assertThat(card.getExpiration()).isEqualTo("01/26");
    }

    @Test
    @DisplayName("of — a card expiring this month is still accepted")
    void ofAcceptsCurrentMonth() {
        PaymentCard card = PaymentCard.of("Visa", "4111111111114242", "Alice", MARCH_2024, MARCH_2024);

        assertThat(card.getExpiration()).isEqualTo("03/24");
    }

    @Test
    @DisplayName("of — expired card is rejected")
    void ofRejectsExpiredCard() {
        assertThatThrownBy(() -> PaymentCard.of("Visa", "4111111111114242", "Alice", YearMonth.of(2024, 2), MARCH_2024))
                .isInstanceOf(OrderDomainException.class)
                .hasMessageContaining("expired");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "12345", "41111111111111111111", "4111abcd11114242"})
    @DisplayName("of — malformed card numbers are rejected")
    void ofRejectsMalformedNumbers(String number) {
        assertThatThrownBy(() -> PaymentCard.of("Visa", number, "Alice", YearMonth.of(2026, 1), MARCH_2024))
                .isInstanceOf(OrderDomainException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    @DisplayName("of — holder name or card type wider than its column is rejected")
    void ofRejectsOverlongText() {
        assertThatThrownBy(() -> PaymentCard.of("Visa", "4111111111114242", "A".repeat(201), YearMonth.of(2026, 1), MARCH_2024))
                .isInstanceOf(OrderDomainException.class)
                .hasMessageContaining("Card holder name exceeds 200 characters");
        assertThatThrownBy(() -> PaymentCard.of("V".repeat(31), "4111111111114242", "Alice", YearMonth.of(2026, 1), MARCH_2024))
                .isInstanceOf(OrderDomainException.class)
                .hasMessageContaining("Card type exceeds 30 characters");
    }
}
