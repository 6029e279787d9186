package com.example.checkout.domain.model;

/**
 * Kinds of events recorded on the operator notification channel.
 */
public enum NotificationType {
    ORDER_CONFIRMED,
    PAYMENT_FAILED,
    ORDER_CANCELLED,
    ORDER_STATUS_CHANGED,
    ORDER_EXPIRED,
    /**
     * Payment was captured by the provider but the order could not be fulfilled locally.
     */
    REQUIRES_MANUAL_REFUND,
    LOW_STOCK
}
