package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.OrderView;

import java.time.Duration;
import java.util.List;

/**
 * Inbound port for order queries.
 */
public interface OrderQueryUseCase {

    OrderView getOrder(String userId, String orderId);

    List<OrderView> listOrders(String userId);

    /**
     * Operator query for pending orders older than the given age.
     */
    List<OrderView> findStalePending(Duration olderThan);
}
