package com.eshop.ordering.command;

public record CancelOrderCommand(String orderId, String reason, String requestId) implements OrderCommand {
}
