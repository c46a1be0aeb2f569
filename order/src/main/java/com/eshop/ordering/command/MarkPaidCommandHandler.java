package com.eshop.ordering.command;

import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderTransition;
import org.springframework.stereotype.Service;

@Service
public class MarkPaidCommandHandler extends AbstractOrderCommandHandler<MarkPaidCommand> {

    public MarkPaidCommandHandler(OrderCommandContext context) {
        super(context);
    }

    @Override
    protected void apply(Order order, MarkPaidCommand command) {
        order.setPaidStatus();
    }

    @Override
    protected String orderId(MarkPaidCommand command) {
        return command.orderId();
    }

    @Override
    protected OrderTransition transition(MarkPaidCommand command) {
        return OrderTransition.SET_PAID;
    }

    @Override
    protected String commandName() {
        return "MarkPaid";
    }
}
