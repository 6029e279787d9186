package com.example.checkout.infrastructure.persistence.entity;

/**
 * Notification type enum for persistence layer.
 */
public enum NotificationTypeEnum {
    ORDER_CONFIRMED,
    PAYMENT_FAILED,
    ORDER_CANCELLED,
    ORDER_STATUS_CHANGED,
    ORDER_EXPIRED,
    REQUIRES_MANUAL_REFUND,
    LOW_STOCK
}
