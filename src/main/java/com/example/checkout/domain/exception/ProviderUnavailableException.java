package com.example.checkout.domain.exception;

import com.example.checkout.domain.model.OrderId;

/**
 * Exception thrown when the payment provider could not register an order.
 * The order stays pending, so the checkout can be retried safely.
 */
public class ProviderUnavailableException extends DomainException {

    private final OrderId orderId;

    public ProviderUnavailableException(OrderId orderId, String message, Throwable cause) {
        super(message, cause);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
