package com.eshop.ordering.scheduler;

import com.eshop.ordering.command.OrderCommandResult;
import com.eshop.ordering.command.SetAwaitingValidationCommand;
import com.eshop.ordering.command.SetAwaitingValidationCommandHandler;
import com.eshop.ordering.config.OrderingProperties;
import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderRepository;
import com.eshop.ordering.domain.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Moves submitted orders into stock validation once the buyer's grace period is over.
 *
 * Each order is advanced with the token "grace-period:{orderId}", so overlapping
 * runs on several instances advance it once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GracePeriodScheduler {

    private final OrderRepository orderRepository;
    private final SetAwaitingValidationCommandHandler awaitingValidationHandler;
    private final OrderingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${ordering.grace-period.poll-interval-ms:10000}")
    public void scheduledCheck() {
        if (!properties.getGracePeriod().isEnabled()) {
            return;
        }
        try {
            advanceExpiredOrders();
        } catch (RuntimeException e) {
            log.error("Grace period check failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of orders moved to AWAITING_VALIDATION by this run
     */
    public int advanceExpiredOrders() {
        OrderingProperties.GracePeriod settings = properties.getGracePeriod();
        Instant cutoff = clock.instant().minus(settings.getPeriod());
        List<Order> due = orderRepository.findByStatusAndOrderDateBeforeOrderByOrderDateAsc(
                OrderStatus.SUBMITTED, cutoff, PageRequest.of(0, settings.getBatchSize()));

        int advanced = 0;
        for (Order order : due) {
            OrderCommandResult result = awaitingValidationHandler.handle(
                    new SetAwaitingValidationCommand(order.getId(), "grace-period:" + order.getId()));
            if (result instanceof OrderCommandResult.Accepted accepted && !accepted.replayed()) {
                advanced++;
            } else if (result instanceof OrderCommandResult.Rejected rejected) {
                log.debug("Grace period transition skipped: orderId={}, reason={}",
                        order.getId(), rejected.error().message());
            }
        }

        if (advanced > 0) {
            log.info("Grace period expired, orders sent to stock validation: count={}", advanced);
        }
        return advanced;
    }
}
