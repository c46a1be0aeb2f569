package com.eshop.ordering.api;

import com.eshop.ordering.command.CancelOrderCommand;
import com.eshop.ordering.command.CancelOrderCommandHandler;
import com.eshop.ordering.command.ConfirmStockCommand;
import com.eshop.ordering.command.ConfirmStockCommandHandler;
import com.eshop.ordering.command.CreateOrderCommand;
import com.eshop.ordering.command.CreateOrderCommandHandler;
import com.eshop.ordering.command.MarkPaidCommand;
import com.eshop.ordering.command.MarkPaidCommandHandler;
import com.eshop.ordering.command.MarkShippedCommand;
import com.eshop.ordering.command.MarkShippedCommandHandler;
import com.eshop.ordering.command.OrderCommandResult;
import com.eshop.ordering.command.SetAwaitingValidationCommand;
import com.eshop.ordering.command.SetAwaitingValidationCommandHandler;
import com.eshop.ordering.domain.OrderDomainException;
import com.eshop.ordering.domain.OrderError;
import com.eshop.ordering.query.OrderEventView;
import com.eshop.ordering.query.OrderQueryService;
import com.eshop.ordering.query.OrderView;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.net.URI;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Order REST Controller
 *
 * Write endpoints: POST /api/orders, PATCH /api/orders/{id}/{transition}
 *   → command handler → order + outbox + request log in one transaction
 *   Every write accepts an optional X-Request-Id header; a repeated id replays
 *   the first outcome.
 *
 * Read endpoints: GET /api/orders/{id}, GET /api/orders/buyer/{buyerId}, GET /api/orders/{id}/events
 *   → OrderQueryService → Redis (with DB fallback)
 */
@Slf4j
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final CreateOrderCommandHandler createOrderHandler;
    private final SetAwaitingValidationCommandHandler awaitingValidationHandler;
    private final ConfirmStockCommandHandler confirmStockHandler;
    private final MarkPaidCommandHandler markPaidHandler;
    private final MarkShippedCommandHandler markShippedHandler;
    private final CancelOrderCommandHandler cancelOrderHandler;
    private final OrderQueryService queryService;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<CommandResponse> createOrder(
            @Valid @RequestBody CreateOrderRequest request,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId) {

        CreateOrderCommand command = new CreateOrderCommand(
                request.getBuyerId(),
                request.getBuyerName(),
                new CreateOrderCommand.ShippingAddress(
                        request.getAddress().getStreet(),
                        request.getAddress().getCity(),
                        request.getAddress().getState(),
                        request.getAddress().getCountry(),
                        request.getAddress().getZipCode()),
                new CreateOrderCommand.Card(
                        request.getCard().getCardType(),
                        request.getCard().getCardNumber(),
                        request.getCard().getCardHolderName(),
                        request.getCard().getExpiration()),
                request.getItems().stream()
                        .map(i -> new CreateOrderCommand.Item(i.getProductId(), i.getProductName(),
                                i.getUnitPrice(), i.getDiscount(), i.getPictureUrl(), i.getUnits()))
                        .toList(),
                requestId);

        OrderCommandResult.Accepted accepted = acceptedOrThrow(createOrderHandler.handle(command));
        CommandResponse response = CommandResponse.from(accepted);
        if (accepted.replayed()) {
            return ResponseEntity.ok(response);
        }
        return ResponseEntity.created(URI.create("/api/orders/" + accepted.orderId())).body(response);
    }

    @PatchMapping("/{orderId}/awaiting-validation")
    public ResponseEntity<CommandResponse> setAwaitingValidation(
            @PathVariable String orderId,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId) {
        return respond(awaitingValidationHandler.handle(new SetAwaitingValidationCommand(orderId, requestId)));
    }

    /**
     * Records the stock check outcome. An empty or missing rejectedProductIds confirms the order.
     */
    @PatchMapping("/{orderId}/stock")
    public ResponseEntity<CommandResponse> confirmStock(
            @PathVariable String orderId,
            @RequestBody(required = false) StockValidationRequest body,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId) {
        List<Long> rejected = body != null ? body.getRejectedProductIds() : null;
        return respond(confirmStockHandler.handle(new ConfirmStockCommand(orderId, rejected, requestId)));
    }

    @PatchMapping("/{orderId}/payment")
    public ResponseEntity<CommandResponse> markPaid(
            @PathVariable String orderId,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId) {
        return respond(markPaidHandler.handle(new MarkPaidCommand(orderId, requestId)));
    }

    @PatchMapping("/{orderId}/ship")
    public ResponseEntity<CommandResponse> markShipped(
            @PathVariable String orderId,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId) {
        return respond(markShippedHandler.handle(new MarkShippedCommand(orderId, requestId)));
    }

    @PatchMapping("/{orderId}/cancel")
    public ResponseEntity<CommandResponse> cancelOrder(
            @PathVariable String orderId,
            @RequestBody(required = false) Map<String, String> body,
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId) {

        String reason = body != null ? body.getOrDefault("reason", "Customer requested cancellation")
                                     : "Customer requested cancellation";
        return respond(cancelOrderHandler.handle(new CancelOrderCommand(orderId, reason, requestId)));
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderView> getOrder(@PathVariable String orderId) {
        return queryService.getOrder(orderId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new OrderDomainException(OrderError.notFound(orderId)));
    }

    @GetMapping("/buyer/{buyerId}")
    public ResponseEntity<List<OrderView>> getOrdersByBuyer(@PathVariable String buyerId) {
        return ResponseEntity.ok(queryService.getOrdersByBuyer(buyerId));
    }

    /**
     * GET /api/orders/{orderId}/events
     * Every integration event the order produced, with its delivery state.
     */
    @GetMapping("/{orderId}/events")
    public ResponseEntity<Map<String, Object>> getOrderEvents(@PathVariable String orderId) {
        List<OrderEventView> events = queryService.getEventHistory(orderId);
        return ResponseEntity.ok(Map.of(
                "orderId", orderId,
                "events", events,
                "count", events.size()
        ));
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private ResponseEntity<CommandResponse> respond(OrderCommandResult result) {
        return ResponseEntity.status(HttpStatus.OK).body(CommandResponse.from(acceptedOrThrow(result)));
    }

    private static OrderCommandResult.Accepted acceptedOrThrow(OrderCommandResult result) {
        if (result instanceof OrderCommandResult.Rejected rejected) {
            throw new OrderDomainException(rejected.error());
        }
        return (OrderCommandResult.Accepted) result;
    }
}

// ─── Request / Response DTOs ───────────────────────────────────────────────────

@Data
class CreateOrderRequest {
    @NotBlank @Size(max = 50) private String buyerId;
    @NotBlank @Size(max = 200) private String buyerName;
    @Valid @NotNull private AddressRequest address;
    @Valid @NotNull private CardRequest card;
    @Valid @NotEmpty @Size(max = 100) private List<OrderItemRequest> items;

    @Data
    static class AddressRequest {
        @NotBlank @Size(max = 200) private String street;
        @NotBlank @Size(max = 100) private String city;
        @NotBlank @Size(max = 100) private String state;
        @NotBlank @Size(max = 100) private String country;
        @NotBlank @Size(max = 20) private String zipCode;
    }

    @Data
    static class CardRequest {
        @NotBlank @Size(max = 30) private String cardType;
        @NotBlank private String cardNumber;
        @NotBlank @Size(max = 200) private String cardHolderName;
        @NotNull @JsonFormat(pattern = "MM/yy") private YearMonth expiration;
    }

    @Data
    static class OrderItemRequest {
        @NotNull private Long productId;
        @NotBlank @Size(max = 200) private String productName;
        @NotNull @DecimalMin("0.00") private BigDecimal unitPrice;
        @DecimalMin("0.00") private BigDecimal discount;
        @Size(max = 500) private String pictureUrl;
        @Min(1) private int units;
    }
}

@Data
class StockValidationRequest {
    private List<Long> rejectedProductIds;
}

@Data
@lombok.Builder
class CommandResponse {
    private String orderId;
    private String status;
    private boolean replayed;
    private Map<String, String> links;

    static CommandResponse from(OrderCommandResult.Accepted accepted) {
        return CommandResponse.builder()
                .orderId(accepted.orderId())
                .status(accepted.status().name())
                .replayed(accepted.replayed())
                .links(Map.of(
                        "self", "/api/orders/" + accepted.orderId(),
                        "events", "/api/orders/" + accepted.orderId() + "/events"
                ))
                .build();
    }
}
