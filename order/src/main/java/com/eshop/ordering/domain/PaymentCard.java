package com.eshop.ordering.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;

/**
 * Payment card descriptor captured at checkout. Only the last four digits of
 * the card number are ever stored.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentCard {

    public static final DateTimeFormatter EXPIRATION_FORMAT = DateTimeFormatter.ofPattern("MM/yy");

    private static final int MIN_DIGITS = 12;
    private static final int MAX_DIGITS = 19;
    private static final int MAX_CARD_TYPE_LENGTH = 30;
    private static final int MAX_HOLDER_NAME_LENGTH = 200;

    @Column(name = "card_type", nullable = false, length = MAX_CARD_TYPE_LENGTH)
    private String cardType;

    @Column(name = "card_number_masked", nullable = false, length = 25)
    private String maskedNumber;

    @Column(name = "card_holder_name", nullable = false, length = MAX_HOLDER_NAME_LENGTH)
    private String cardHolderName;

    @Column(name = "card_expiration", nullable = false, length = 5)
    private String expiration;

    /**
     * @param cardNumber   raw card number; spaces and dashes are ignored
     * @param currentMonth the month the card must still be valid in
     */
    public static PaymentCard of(String cardType, String cardNumber, String cardHolderName,
                                 YearMonth expiration, YearMonth currentMonth) {
        if (cardType == null || cardType.isBlank()) {
            throw invalid("Card type is required");
        }
        if (cardType.trim().length() > MAX_CARD_TYPE_LENGTH) {
            throw invalid("Card type exceeds " + MAX_CARD_TYPE_LENGTH + " characters");
        }
        if (cardHolderName == null || cardHolderName.isBlank()) {
            throw invalid("Card holder name is required");
        }
        if (cardHolderName.trim().length() > MAX_HOLDER_NAME_LENGTH) {
            throw invalid("Card holder name exceeds " + MAX_HOLDER_NAME_LENGTH + " characters");
        }
        String digits = cardNumber == null ? "" : cardNumber.replace(" ", "").replace("-", "");
        if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS || !digits.chars().allMatch(Character::isDigit)) {
            throw invalid("Card number is malformed");
        }
        if (expiration == null) {
            throw invalid("Card expiration is required");
        }
        if (expiration.isBefore(currentMonth)) {
            throw invalid("Card expired on " + expiration.format(EXPIRATION_FORMAT));
        }
        return new PaymentCard(cardType.trim(), mask(digits), cardHolderName.trim(),
                expiration.format(EXPIRATION_FORMAT));
    }

    public String getLastFourDigits() {
        return maskedNumber.substring(maskedNumber.length() - 4);
    }

    private static String mask(String digits) {
        return "*".repeat(digits.length() - 4) + digits.substring(digits.length() - 4);
    }

    private static OrderDomainException invalid(String message) {
        return new OrderDomainException(OrderError.validation(null, OrderTransition.SUBMIT, null, message));
    }
}
