package com.eshop.ordering.command;

import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderDomainEvent;
import com.eshop.ordering.domain.OrderRepository;
import com.eshop.ordering.events.OrderIntegrationEvent;
import com.eshop.ordering.events.OrderIntegrationEventMapper;
import com.eshop.shared.outbox.OutboxRecord;
import com.eshop.shared.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one command's effects in the caller's transaction:
 *  1. order state (flushed now so version conflicts surface before anything else)
 *  2. one outbox row per staged domain event
 *  3. the request-log row for the idempotency token, if any
 *
 * Any failure rolls all three back together.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderUnitOfWork {

    private final OrderRepository orderRepository;
    private final OutboxService outboxService;
    private final ProcessedRequestRepository processedRequestRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public List<OutboxRecord> commit(Order order, String commandName, String requestKey) {
        Instant now = clock.instant();
        order.touch(now);
        orderRepository.saveAndFlush(order);
        List<OutboxRecord> appended = new ArrayList<>();
        for (OrderDomainEvent domainEvent : order.pullDomainEvents()) {
            OrderIntegrationEvent event = OrderIntegrationEventMapper.toIntegrationEvent(domainEvent, now);
            appended.add(outboxService.append(Order.AGGREGATE_TYPE, event));
        }

        if (requestKey != null) {
            processedRequestRepository.saveAndFlush(
                    new ProcessedRequest(requestKey, commandName, order.getId(), order.getStatus(), now));
        }

        log.debug("Unit of work committed: orderId={}, status={}, events={}, requestKey={}",
                order.getId(), order.getStatus(), appended.size(), requestKey);
        return appended;
    }
}
