package com.eshop.ordering.api;

import com.eshop.ordering.domain.OrderDomainException;
import com.eshop.ordering.domain.OrderError;
import com.eshop.ordering.domain.OrderErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps order rejections and infrastructure failures to HTTP responses.
 *
 *  VALIDATION           → 400
 *  ORDER_NOT_FOUND      → 404
 *  INVALID_TRANSITION   → 409
 *  CONCURRENCY_CONFLICT → 409
 *  database unavailable → 503
 *  anything else        → 500
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(OrderDomainException.class)
    public ResponseEntity<ErrorResponse> handleOrderDomainException(OrderDomainException e) {
        OrderError error = e.getError();
        return ResponseEntity.status(mapErrorKindToHttpStatus(error.kind())).body(ErrorResponse.of(error));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {}", message);
        return ResponseEntity.badRequest().body(ErrorResponse.of(
                OrderErrorKind.VALIDATION.getCode(), OrderErrorKind.VALIDATION.name(), message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(
                OrderErrorKind.VALIDATION.getCode(), OrderErrorKind.VALIDATION.name(), "Malformed request body"));
    }

    @ExceptionHandler({DataAccessResourceFailureException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(RuntimeException e) {
        log.error("Order store unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.of(
                "SYS503", "UNAVAILABLE", "Order store is temporarily unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Internal server error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(
                "SYS500", "INTERNAL", "Internal server error"));
    }

    private HttpStatus mapErrorKindToHttpStatus(OrderErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case ORDER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION, CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
        };
    }
}
