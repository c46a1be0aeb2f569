package com.eshop.ordering.command;

import java.util.List;

/**
 * Outcome of the stock check. An empty {@code rejectedProductIds} confirms the order;
 * any rejected product cancels it.
 */
public record ConfirmStockCommand(String orderId, List<Long> rejectedProductIds, String requestId)
        implements OrderCommand {

    public ConfirmStockCommand {
        rejectedProductIds = rejectedProductIds == null ? List.of() : List.copyOf(rejectedProductIds);
    }

    public boolean isConfirmed() {
        return rejectedProductIds.isEmpty();
    }
}
