package com.eshop.ordering.api;

import com.eshop.ordering.domain.OrderError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String kind,
        String message,
        String orderId,
        String transition,
        String currentStatus,
        Instant timestamp
) {

    public static ErrorResponse of(String code, String kind, String message) {
        return new ErrorResponse(code, kind, message, null, null, null, Instant.now());
    }

    public static ErrorResponse of(OrderError error) {
        return new ErrorResponse(
                error.kind().getCode(),
                error.kind().name(),
                error.message(),
                error.orderId(),
                error.transition() != null ? error.transition().name() : null,
                error.currentStatus() != null ? error.currentStatus().name() : null,
                Instant.now()
        );
    }
}
