package com.example.checkout.domain.exception;

import com.example.checkout.domain.model.OrderId;

/**
 * A valid payment could not be confirmed because the store kept failing transiently.
 * The payment is recorded on the still pending order; the caller should resend the callback.
 */
public class ConfirmationDeferredException extends DomainException {

    private final OrderId orderId;

    public ConfirmationDeferredException(OrderId orderId, Throwable cause) {
        super("Payment for order " + orderId + " was received but could not be confirmed yet, please retry", cause);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
