package com.eshop.ordering.command;

public record SetAwaitingValidationCommand(String orderId, String requestId) implements OrderCommand {
}
