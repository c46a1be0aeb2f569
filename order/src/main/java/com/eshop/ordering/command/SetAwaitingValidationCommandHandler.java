package com.eshop.ordering.command;

import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderTransition;
import org.springframework.stereotype.Service;

@Service
public class SetAwaitingValidationCommandHandler extends AbstractOrderCommandHandler<SetAwaitingValidationCommand> {

    public SetAwaitingValidationCommandHandler(OrderCommandContext context) {
        super(context);
    }

    @Override
    protected void apply(Order order, SetAwaitingValidationCommand command) {
        order.setAwaitingValidationStatus();
    }

    @Override
    protected String orderId(SetAwaitingValidationCommand command) {
        return command.orderId();
    }

    @Override
    protected OrderTransition transition(SetAwaitingValidationCommand command) {
        return OrderTransition.SET_AWAITING_VALIDATION;
    }

    @Override
    protected String commandName() {
        return "SetAwaitingValidation";
    }
}
