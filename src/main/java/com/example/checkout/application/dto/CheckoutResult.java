package com.example.checkout.application.dto;

import com.example.checkout.domain.model.Order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of a checkout: a pending order registered with the payment provider.
 */
public record CheckoutResult(
        String orderId,
        String providerOrderId,
        BigDecimal amount,
        long amountInMinorUnits,
        String currency,
        String status,
        Instant createdAt
) {
    /**
     * Creates the result for an order that now carries a provider reference.
     */
    public static CheckoutResult registered(Order order, String providerOrderId) {
        return new CheckoutResult(
                order.getOrderId().getValue(),
                providerOrderId,
                order.getTotalAmount().getAmount(),
                order.getTotalAmount().toMinorUnits(),
                order.getCurrency(),
                order.getStatus().wireName(),
                order.getCreatedAt());
    }
}
