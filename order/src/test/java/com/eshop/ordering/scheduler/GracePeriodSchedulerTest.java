package com.eshop.ordering.scheduler;

import com.eshop.ordering.command.OrderCommandResult;
import com.eshop.ordering.command.SetAwaitingValidationCommand;
import com.eshop.ordering.command.SetAwaitingValidationCommandHandler;
import com.eshop.ordering.config.OrderingProperties;
import com.eshop.ordering.domain.Address;
import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderError;
import com.eshop.ordering.domain.OrderRepository;
import com.eshop.ordering.domain.OrderStatus;
import com.eshop.ordering.domain.OrderTransition;
import com.eshop.ordering.domain.PaymentCard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GracePeriodSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock OrderRepository orderRepository;
    @Mock SetAwaitingValidationCommandHandler awaitingValidationHandler;

    OrderingProperties properties;
    GracePeriodScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new OrderingProperties();
        properties.getGracePeriod().setPeriod(Duration.ofMinutes(2));
        scheduler = new GracePeriodScheduler(orderRepository, awaitingValidationHandler, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Order submittedOrder() {
        return new Order("buyer-1", "Alice",
                Address.of("1 Main St", "Seattle", "WA", "US", "98101"),
                PaymentCard.of("Visa", "4111111111114242", "Alice", YearMonth.of(2030, 1), YearMonth.of(2024, 3)),
                NOW.minus(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("advanceExpiredOrders — looks up orders older than the grace period")
    void queriesWithCutoff() {
        when(orderRepository.findByStatusAndOrderDateBeforeOrderByOrderDateAsc(
                eq(OrderStatus.SUBMITTED), eq(NOW.minus(Duration.ofMinutes(2))), any(Pageable.class)))
                .thenReturn(List.of());

        assertThat(scheduler.advanceExpiredOrders()).isZero();
        verifyNoInteractions(awaitingValidationHandler);
    }

    @Test
    @DisplayName("advanceExpiredOrders — counts only orders this run actually moved")
    void countsAdvancedOrders() {
        Order moved = submittedOrder();
        Order alreadyDone = submittedOrder();
        Order cancelledMeanwhile = submittedOrder();
        when(orderRepository.findByStatusAndOrderDateBeforeOrderByOrderDateAsc(any(), any(), any()))
                .thenReturn(List.of(moved, alreadyDone, cancelledMeanwhile));
        when(awaitingValidationHandler.handle(any())).thenReturn(
                new OrderCommandResult.Accepted(moved.getId(), OrderStatus.AWAITING_VALIDATION, false),
                new OrderCommandResult.Accepted(alreadyDone.getId(), OrderStatus.AWAITING_VALIDATION, true),
                new OrderCommandResult.Rejected(OrderError.invalidTransition(cancelledMeanwhile.getId(),
                        OrderTransition.SET_AWAITING_VALIDATION, OrderStatus.CANCELLED)));

        assertThat(scheduler.advanceExpiredOrders()).isEqualTo(1);
        verify(awaitingValidationHandler).handle(
                new SetAwaitingValidationCommand(moved.getId(), "grace-period:" + moved.getId()));
    }

    @Test
    @DisplayName("scheduledCheck — does nothing when disabled")
    void disabled() {
        properties.getGracePeriod().setEnabled(false);

        scheduler.scheduledCheck();

        verifyNoInteractions(orderRepository, awaitingValidationHandler);
    }

    @Test
    @DisplayName("scheduledCheck — a failing run is logged, not thrown")
    void failureContained() {
        when(orderRepository.findByStatusAndOrderDateBeforeOrderByOrderDateAsc(any(), any(), any()))
                .thenThrow(new IllegalStateException("database down"));

        scheduler.scheduledCheck();

        verifyNoInteractions(awaitingValidationHandler);
    }
}
