package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.OrderView;

import java.time.Duration;

/**
 * Inbound port for order status changes after checkout.
 */
public interface OrderLifecycleUseCase {

    /**
     * Cancels an order on behalf of its owner, restoring stock if it was committed.
     */
    OrderView cancel(String userId, String orderId);

    /**
     * Operator status change, validated against the transition table.
     */
    OrderView updateStatus(String orderId, String status);

    /**
     * Cancels pending orders older than the given age. Orders that already carry a captured
     * payment are flagged for manual refund instead of cancelled.
     *
     * @return number of orders expired
     */
    int expireStalePending(Duration olderThan);
}
