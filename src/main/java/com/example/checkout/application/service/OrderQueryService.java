package com.example.checkout.application.service;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.port.in.OrderQueryUseCase;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.domain.exception.AccessDeniedException;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read-side queries over orders.
 */
@Service
public class OrderQueryService implements OrderQueryUseCase {

    private final OrderStorePort orderStore;

    public OrderQueryService(OrderStorePort orderStore) {
        this.orderStore = orderStore;
    }

    @Override
    public OrderView getOrder(String userId, String orderId) {
        Order order = orderStore.findById(OrderId.of(orderId))
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.isOwnedBy(userId)) {
            throw new AccessDeniedException("Not authorized to view order " + orderId);
        }
        return OrderView.from(order);
    }

    @Override
    public List<OrderView> listOrders(String userId) {
        return orderStore.findByUserId(userId).stream()
                .map(OrderView::from)
                .toList();
    }

    @Override
    public List<OrderView> findStalePending(Duration olderThan) {
        return orderStore.findPendingCreatedBefore(Instant.now().minus(olderThan)).stream()
                .map(OrderView::from)
                .toList();
    }
}
