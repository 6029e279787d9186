package com.example.checkout.domain.exception;

/**
 * Exception thrown when an order id does not resolve to a stored order.
 */
public class OrderNotFoundException extends DomainException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super("Order not found: " + orderId);
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }
}
