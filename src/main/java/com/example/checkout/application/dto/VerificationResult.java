package com.example.checkout.application.dto;

import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderStatus;

/**
 * Outcome of a payment callback as reported to the payer.
 * The manual refund flag is not part of it, operators see it through notifications.
 */
public record VerificationResult(
        String orderId,
        String status,
        boolean alreadyProcessed,
        String message
) {
    public static VerificationResult confirmed(Order order) {
        return new VerificationResult(order.getOrderId().getValue(), OrderStatus.CONFIRMED.wireName(), false,
                "Payment verified and order confirmed");
    }

    public static VerificationResult alreadyProcessed(Order order) {
        return new VerificationResult(order.getOrderId().getValue(), order.getStatus().wireName(), true,
                "Payment already processed");
    }

    public static VerificationResult unfulfillable(Order order, OrderStatus status) {
        return new VerificationResult(order.getOrderId().getValue(), status.wireName(), false,
                "Payment received but the order could not be fulfilled. A refund will be arranged.");
    }
}
