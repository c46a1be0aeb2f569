package com.eshop.ordering.command;

import com.eshop.ordering.domain.Address;
import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderError;
import com.eshop.ordering.domain.OrderTransition;
import com.eshop.ordering.domain.PaymentCard;
import org.springframework.stereotype.Service;

import java.time.YearMonth;

/**
 * Creates an order with its lines. The order id is assigned here; a retried
 * request with the same token gets the id of the first attempt back.
 */
@Service
public class CreateOrderCommandHandler extends AbstractOrderCommandHandler<CreateOrderCommand> {

    public CreateOrderCommandHandler(OrderCommandContext context) {
        super(context);
    }

    @Override
    protected OrderError validate(CreateOrderCommand command) {
        if (command.address() == null) {
            return OrderError.validation(null, OrderTransition.SUBMIT, null, "Shipping address is required");
        }
        if (command.card() == null) {
            return OrderError.validation(null, OrderTransition.SUBMIT, null, "Payment card is required");
        }
        if (command.items() == null || command.items().isEmpty()) {
            return OrderError.validation(null, OrderTransition.SUBMIT, null, "An order needs at least one item");
        }
        if (command.items().size() > Order.MAX_ORDER_ITEMS) {
            return OrderError.validation(null, OrderTransition.SUBMIT, null,
                    "An order holds at most " + Order.MAX_ORDER_ITEMS + " lines");
        }
        return null;
    }

    @Override
    protected boolean createsOrder() {
        return true;
    }

    @Override
    protected Order resolveOrder(CreateOrderCommand command) {
        CreateOrderCommand.ShippingAddress a = command.address();
        CreateOrderCommand.Card c = command.card();
        Address address = Address.of(a.street(), a.city(), a.state(), a.country(), a.zipCode());
        PaymentCard card = PaymentCard.of(c.cardType(), c.cardNumber(), c.cardHolderName(), c.expiration(),
                YearMonth.now(context.getClock()));
        return new Order(command.buyerId(), command.buyerName(), address, card, context.getClock().instant());
    }

    @Override
    protected void apply(Order order, CreateOrderCommand command) {
        for (CreateOrderCommand.Item item : command.items()) {
            order.addOrderItem(item.productId(), item.productName(), item.unitPrice(), item.discount(),
                    item.pictureUrl(), item.units());
        }
    }

    @Override
    protected String orderId(CreateOrderCommand command) {
        return null;
    }

    @Override
    protected OrderTransition transition(CreateOrderCommand command) {
        return OrderTransition.SUBMIT;
    }

    @Override
    protected String commandName() {
        return "CreateOrder";
    }
}
