package com.eshop.ordering.command;

import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderTransition;
import org.springframework.stereotype.Service;

@Service
public class CancelOrderCommandHandler extends AbstractOrderCommandHandler<CancelOrderCommand> {

    public CancelOrderCommandHandler(OrderCommandContext context) {
        super(context);
    }

    @Override
    protected void apply(Order order, CancelOrderCommand command) {
        order.setCancelledStatus(command.reason());
    }

    @Override
    protected String orderId(CancelOrderCommand command) {
        return command.orderId();
    }

    @Override
    protected OrderTransition transition(CancelOrderCommand command) {
        return OrderTransition.SET_CANCELLED;
    }

    @Override
    protected String commandName() {
        return "CancelOrder";
    }
}
