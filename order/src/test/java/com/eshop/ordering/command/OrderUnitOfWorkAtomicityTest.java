package com.eshop.ordering.command;

import com.eshop.ordering.AbstractOrderingIntegrationTest;
import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderStatus;
import com.eshop.ordering.events.OrderIntegrationEvent;
import com.eshop.shared.events.EventTypes;
import com.eshop.shared.outbox.OutboxRecord;
import com.eshop.shared.outbox.OutboxService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

/**
 * A failing outbox write must take the order change and the request log down with it.
 */
class OrderUnitOfWorkAtomicityTest extends AbstractOrderingIntegrationTest {

    @SpyBean OutboxService outboxService;

    @Autowired CreateOrderCommandHandler createOrderHandler;
    @Autowired SetAwaitingValidationCommandHandler awaitingValidationHandler;
    @Autowired ConfirmStockCommandHandler confirmStockHandler;
    @Autowired MarkPaidCommandHandler markPaidHandler;

    @Test
    @DisplayName("commit — outbox failure rolls back the status change and the request log")
    void outboxFailureRollsBack() {
        String orderId = ((OrderCommandResult.Accepted) createOrderHandler.handle(createOrderCommand(null))).orderId();
        awaitingValidationHandler.handle(new SetAwaitingValidationCommand(orderId, null));
        confirmStockHandler.handle(new ConfirmStockCommand(orderId, List.of(), null));

        doThrow(new IllegalStateException("outbox table unavailable"))
                .when(outboxService).append(eq(Order.AGGREGATE_TYPE), any(OrderIntegrationEvent.OrderPaidEvent.class));

        assertThatThrownBy(() -> markPaidHandler.handle(new MarkPaidCommand(orderId, "evt-pay-1")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("outbox table unavailable");

        assertThat(orderRepository.findById(orderId).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.STOCK_CONFIRMED);
        assertThat(outboxRepository.findAll()).extracting(OutboxRecord::getEventType)
                .doesNotContain(EventTypes.ORDER_PAID);
        assertThat(processedRequestRepository.findById("MarkPaid:evt-pay-1")).isEmpty();
    }
}
