package com.eshop.ordering.command;

public record MarkShippedCommand(String orderId, String requestId) implements OrderCommand {
}
