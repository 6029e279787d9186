package com.example.checkout.infrastructure.persistence.entity;

/**
 * Order status enum for persistence layer.
 */
public enum OrderStatusEnum {
    PENDING,
    CONFIRMED,
    PROCESSING,
    SHIPPED,
    DELIVERED,
    CANCELLED
}
