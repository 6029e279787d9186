package com.example.checkout.domain.exception;

import com.example.checkout.domain.model.OrderId;

/**
 * Exception thrown when a payment callback signature does not match the expected HMAC.
 */
public class SignatureMismatchException extends DomainException {

    private final OrderId orderId;

    public SignatureMismatchException(OrderId orderId) {
        super("Payment signature verification failed for order " + orderId);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
