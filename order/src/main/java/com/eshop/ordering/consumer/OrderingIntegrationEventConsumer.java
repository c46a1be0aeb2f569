package com.eshop.ordering.consumer;

import com.eshop.ordering.command.CancelOrderCommand;
import com.eshop.ordering.command.CancelOrderCommandHandler;
import com.eshop.ordering.command.ConfirmStockCommand;
import com.eshop.ordering.command.ConfirmStockCommandHandler;
import com.eshop.ordering.command.MarkPaidCommand;
import com.eshop.ordering.command.MarkPaidCommandHandler;
import com.eshop.ordering.command.OrderCommandResult;
import com.eshop.ordering.consumer.InboundEvents.PaymentFailedEvent;
import com.eshop.ordering.consumer.InboundEvents.PaymentSucceededEvent;
import com.eshop.ordering.consumer.InboundEvents.StockConfirmedEvent;
import com.eshop.ordering.consumer.InboundEvents.StockRejectedEvent;
import com.eshop.ordering.domain.OrderError;
import com.eshop.ordering.domain.OrderErrorKind;
import com.eshop.shared.events.EventTypes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Ordering Service Kafka Consumers
 *
 * Translates inventory and payment events into order commands. The message's
 * event-id header is the command's idempotency token, so a redelivered message
 * replays the first outcome instead of applying twice.
 *
 * Manual acknowledgment (AckMode.MANUAL_IMMEDIATE):
 *  - command accepted or rejected by an order rule → ack (redelivery cannot help)
 *  - concurrency conflict or infrastructure failure → no ack, the error handler retries
 *  - unparseable message or missing event-id → logged and skipped
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderingIntegrationEventConsumer {

    private final ConfirmStockCommandHandler confirmStockHandler;
    private final MarkPaidCommandHandler markPaidHandler;
    private final CancelOrderCommandHandler cancelOrderHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = EventTypes.TOPIC_INVENTORY_STOCK_CONFIRMED,
            groupId = "${spring.kafka.consumer.group-id:ordering-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onStockConfirmed(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, (eventId, payload) -> {
            StockConfirmedEvent event = objectMapper.readValue(payload, StockConfirmedEvent.class);
            return confirmStockHandler.handle(new ConfirmStockCommand(event.orderId(), List.of(), eventId));
        });
    }

    @KafkaListener(
            topics = EventTypes.TOPIC_INVENTORY_STOCK_REJECTED,
            groupId = "${spring.kafka.consumer.group-id:ordering-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onStockRejected(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, (eventId, payload) -> {
            StockRejectedEvent event = objectMapper.readValue(payload, StockRejectedEvent.class);
            if (event.rejectedProductIds() == null || event.rejectedProductIds().isEmpty()) {
                // an empty rejection would read as a confirmation
                log.error("Stock rejection without product ids skipped: eventId={}, orderId={}",
                        eventId, event.orderId());
                return null;
            }
            return confirmStockHandler.handle(
                    new ConfirmStockCommand(event.orderId(), event.rejectedProductIds(), eventId));
        });
    }

    @KafkaListener(
            topics = EventTypes.TOPIC_PAYMENTS_SUCCEEDED,
            groupId = "${spring.kafka.consumer.group-id:ordering-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onPaymentSucceeded(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, (eventId, payload) -> {
            PaymentSucceededEvent event = objectMapper.readValue(payload, PaymentSucceededEvent.class);
            return markPaidHandler.handle(new MarkPaidCommand(event.orderId(), eventId));
        });
    }

    @KafkaListener(
            topics = EventTypes.TOPIC_PAYMENTS_FAILED,
            groupId = "${spring.kafka.consumer.group-id:ordering-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onPaymentFailed(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, (eventId, payload) -> {
            PaymentFailedEvent event = objectMapper.readValue(payload, PaymentFailedEvent.class);
            String reason = "Payment failed: " + (event.reason() != null ? event.reason() : "unknown reason");
            return cancelOrderHandler.handle(new CancelOrderCommand(event.orderId(), reason, eventId));
        });
    }

    /**
     * Shared processing wrapper:
     * 1. Extract event ID from headers
     * 2. Run the command with the event ID as idempotency token
     * 3. Acknowledge unless the outcome is worth a retry
     */
    private void processEvent(ConsumerRecord<String, String> record, Acknowledgment ack, EventHandler handler) {
        String eventId = extractHeader(record, EventTypes.HEADER_EVENT_ID);
        if (eventId == null) {
            log.warn("Message missing event-id header: topic={}, partition={}, offset={}",
                    record.topic(), record.partition(), record.offset());
            ack.acknowledge();
            return;
        }

        OrderCommandResult result;
        try {
            result = handler.handle(eventId, record.value());
        } catch (JsonProcessingException e) {
            log.error("Unparseable event skipped: eventId={}, topic={}, error={}",
                    eventId, record.topic(), e.getOriginalMessage());
            ack.acknowledge();
            return;
        }

        if (result instanceof OrderCommandResult.Rejected rejected) {
            OrderError error = rejected.error();
            if (error.kind() == OrderErrorKind.CONCURRENCY_CONFLICT) {
                throw new IllegalStateException("Order busy, event will be redelivered: eventId=" + eventId
                        + ", orderId=" + error.orderId());
            }
            log.warn("Event rejected by order rules: eventId={}, topic={}, orderId={}, kind={}, reason={}",
                    eventId, record.topic(), error.orderId(), error.kind(), error.message());
        } else if (result instanceof OrderCommandResult.Accepted accepted) {
            log.debug("Event processed: eventId={}, topic={}, orderId={}, status={}, replayed={}",
                    eventId, record.topic(), accepted.orderId(), accepted.status(), accepted.replayed());
        }
        ack.acknowledge();
    }

    private String extractHeader(ConsumerRecord<?, ?> record, String headerName) {
        Header header = record.headers().lastHeader(headerName);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    @FunctionalInterface
    interface EventHandler {
        OrderCommandResult handle(String eventId, String payload) throws JsonProcessingException;
    }
}
