package com.example.checkout.application.dto;

import com.example.checkout.domain.model.LineItem;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.ShippingAddress;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read model of an order returned by queries and lifecycle operations.
 */
public record OrderView(
        String orderId,
        String userId,
        String status,
        List<LineItemView> items,
        BigDecimal totalAmount,
        String currency,
        ShippingAddress shippingAddress,
        String providerOrderId,
        String providerPaymentId,
        String failureReason,
        boolean requiresManualRefund,
        Instant createdAt,
        Instant updatedAt
) {
    public static OrderView from(Order order) {
        return new OrderView(
                order.getOrderId().getValue(),
                order.getUserId(),
                order.getStatus().wireName(),
                order.getItems().stream().map(LineItemView::from).toList(),
                order.getTotalAmount().getAmount(),
                order.getCurrency(),
                order.getShippingAddress(),
                order.getPaymentReference().providerOrderId(),
                order.getPaymentReference().providerPaymentId(),
                order.getFailureReason(),
                order.isRequiresManualRefund(),
                order.getCreatedAt(),
                order.getUpdatedAt());
    }

    /**
     * Line item with its frozen product snapshot.
     */
    public record LineItemView(
            String productId,
            String name,
            String category,
            BigDecimal unitPrice,
            int quantity,
            BigDecimal totalPrice
    ) {
        static LineItemView from(LineItem item) {
            return new LineItemView(
                    item.getProductId().getValue(),
                    item.getProduct().name(),
                    item.getProduct().category(),
                    item.getProduct().unitPrice().getAmount(),
                    item.getQuantity(),
                    item.getTotalPrice().getAmount());
        }
    }
}
