package com.eshop.ordering.command;

import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderTransition;
import org.springframework.stereotype.Service;

/**
 * Applies the stock check result: confirmed when nothing was rejected,
 * otherwise the order is cancelled with the rejected products recorded.
 */
@Service
public class ConfirmStockCommandHandler extends AbstractOrderCommandHandler<ConfirmStockCommand> {

    public ConfirmStockCommandHandler(OrderCommandContext context) {
        super(context);
    }

    @Override
    protected void apply(Order order, ConfirmStockCommand command) {
        if (command.isConfirmed()) {
            order.setStockConfirmedStatus();
        } else {
            order.setStockRejectedStatus(command.rejectedProductIds());
        }
    }

    @Override
    protected String orderId(ConfirmStockCommand command) {
        return command.orderId();
    }

    @Override
    protected OrderTransition transition(ConfirmStockCommand command) {
        return command.isConfirmed() ? OrderTransition.SET_STOCK_CONFIRMED : OrderTransition.SET_STOCK_REJECTED;
    }

    @Override
    protected String commandName() {
        return "ConfirmStock";
    }
}
