package com.eshop.ordering.command;

import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderTransition;
import org.springframework.stereotype.Service;

@Service
public class MarkShippedCommandHandler extends AbstractOrderCommandHandler<MarkShippedCommand> {

    public MarkShippedCommandHandler(OrderCommandContext context) {
        super(context);
    }

    @Override
    protected void apply(Order order, MarkShippedCommand command) {
        order.setShippedStatus();
    }

    @Override
    protected String orderId(MarkShippedCommand command) {
        return command.orderId();
    }

    @Override
    protected OrderTransition transition(MarkShippedCommand command) {
        return OrderTransition.SET_SHIPPED;
    }

    @Override
    protected String commandName() {
        return "MarkShipped";
    }
}
