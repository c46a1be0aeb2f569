package com.eshop.ordering.command;

import com.eshop.ordering.command.OrderCommandResult.Accepted;
import com.eshop.ordering.command.OrderCommandResult.Rejected;
import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderDomainException;
import com.eshop.ordering.domain.OrderError;
import com.eshop.ordering.domain.OrderTransition;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Template for every order command:
 *
 *  1. validate the command before touching anything
 *  2. open a transaction
 *  3. load the target order under a row lock (creation has nothing to lock)
 *  4. replay the stored outcome if the idempotency token was already processed,
 *     otherwise create the order if needed and apply one aggregate method
 *  5. commit order + outbox rows + request log through {@link OrderUnitOfWork}
 *  6. evict the read model entry
 *
 * Rule violations roll back and come back as {@link Rejected}. Lost concurrency
 * races are retried by {@link CommandRetry}. Anything else is thrown.
 */
@Slf4j
public abstract class AbstractOrderCommandHandler<C extends OrderCommand> {

    /** Leaves room for the command-name prefix in the 255-character request key. */
    static final int MAX_REQUEST_ID_LENGTH = 200;

    protected final OrderCommandContext context;

    protected AbstractOrderCommandHandler(OrderCommandContext context) {
        this.context = context;
    }

    public OrderCommandResult handle(C command) {
        OrderError invalid = validate(command);
        if (invalid == null && command.requestId() != null && command.requestId().length() > MAX_REQUEST_ID_LENGTH) {
            invalid = OrderError.validation(orderId(command), transition(command), null,
                    "Request id exceeds " + MAX_REQUEST_ID_LENGTH + " characters");
        }
        if (invalid != null) {
            log.warn("Command rejected: command={}, orderId={}, kind={}, reason={}",
                    commandName(), orderId(command), invalid.kind(), invalid.message());
            return new Rejected(invalid);
        }

        String requestKey = command.requestId() == null || command.requestId().isBlank()
                ? null
                : commandName() + ":" + command.requestId();

        OrderCommandResult result;
        try {
            result = context.getCommandRetry().execute(commandName(), orderId(command),
                    () -> context.getTransactionTemplate().execute(status -> execute(command, requestKey)));
        } catch (OrderDomainException e) {
            OrderError error = e.getError();
            log.warn("Command rejected: command={}, orderId={}, kind={}, reason={}",
                    commandName(), error.orderId(), error.kind(), error.message());
            return new Rejected(error);
        } catch (ConcurrencyConflictException e) {
            return new Rejected(OrderError.concurrencyConflict(orderId(command), transition(command)));
        }

        if (result instanceof Accepted accepted && !accepted.replayed()) {
            context.getQueryService().evict(accepted.orderId());
        }
        return result;
    }

    private OrderCommandResult execute(C command, String requestKey) {
        // A twin holding the same token waits here until the first one committed its request log
        Order order = createsOrder() ? null : resolveOrder(command);

        if (requestKey != null) {
            Optional<ProcessedRequest> processed = context.getProcessedRequestRepository().findById(requestKey);
            if (processed.isPresent()) {
                return replay(command, requestKey, processed.get());
            }
        }

        if (order == null) {
            order = resolveOrder(command);
        }
        apply(order, command);
        context.getUnitOfWork().commit(order, commandName(), requestKey);

        log.info("Command applied: command={}, orderId={}, status={}",
                commandName(), order.getId(), order.getStatus());
        return new Accepted(order.getId(), order.getStatus(), false);
    }

    private OrderCommandResult replay(C command, String requestKey, ProcessedRequest prior) {
        String orderId = orderId(command);
        if (!createsOrder() && !prior.getOrderId().equals(orderId)) {
            throw new OrderDomainException(OrderError.validation(orderId, transition(command), null,
                    "Request id " + command.requestId() + " was already used for order " + prior.getOrderId()));
        }
        log.info("Duplicate request replayed: command={}, requestKey={}, orderId={}, status={}",
                commandName(), requestKey, prior.getOrderId(), prior.getResultStatus());
        return new Accepted(prior.getOrderId(), prior.getResultStatus(), true);
    }

    /** True when the command builds a new order instead of loading one. */
    protected boolean createsOrder() {
        return false;
    }

    /** Loads the target order with a row lock held until commit. */
    protected Order resolveOrder(C command) {
        String orderId = orderId(command);
        return context.getOrderRepository().findWithLockById(orderId)
                .orElseThrow(() -> new OrderDomainException(OrderError.notFound(orderId)));
    }

    /** Returns the rejection for a malformed command, or null. */
    protected OrderError validate(C command) {
        String orderId = orderId(command);
        if (orderId == null || orderId.isBlank()) {
            return OrderError.validation(null, transition(command), null, "Order id is required");
        }
        return null;
    }

    protected abstract void apply(Order order, C command);

    protected abstract String orderId(C command);

    protected abstract OrderTransition transition(C command);

    protected abstract String commandName();
}
