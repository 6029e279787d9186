package com.example.checkout.domain.exception;

import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderStatus;

/**
 * Exception thrown when an order status change is not allowed by the transition table,
 * or when the order changed underneath a conditional status write.
 */
public class InvalidTransitionException extends DomainException {

    private final OrderId orderId;
    private final OrderStatus from;
    private final OrderStatus to;

    public InvalidTransitionException(OrderId orderId, OrderStatus from, OrderStatus to) {
        this(orderId, from, to, String.format("Cannot transition order %s from %s to %s",
                orderId, from.wireName(), to.wireName()));
    }

    public InvalidTransitionException(OrderId orderId, OrderStatus from, OrderStatus to, String message) {
        super(message);
        this.orderId = orderId;
        this.from = from;
        this.to = to;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public OrderStatus getFrom() {
        return from;
    }

    public OrderStatus getTo() {
        return to;
    }
}
