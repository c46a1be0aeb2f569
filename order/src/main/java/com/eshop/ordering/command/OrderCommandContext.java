package com.eshop.ordering.command;

import com.eshop.ordering.domain.OrderRepository;
import com.eshop.ordering.query.OrderQueryService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Collaborators every command handler needs.
 */
@Getter
@Component
@RequiredArgsConstructor
public class OrderCommandContext {

    private final OrderRepository orderRepository;
    private final ProcessedRequestRepository processedRequestRepository;
    private final OrderUnitOfWork unitOfWork;
    private final TransactionTemplate transactionTemplate;
    private final CommandRetry commandRetry;
    private final OrderQueryService queryService;
    private final Clock clock;
}
