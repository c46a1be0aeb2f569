package com.eshop.ordering.command;

public record MarkPaidCommand(String orderId, String requestId) implements OrderCommand {
}
