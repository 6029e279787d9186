package com.example.checkout.infrastructure.persistence.entity;

/**
 * Status of a checkout idempotency record.
 */
public enum IdempotencyStatus {
    IN_PROGRESS,  // Checkout running
    COMPLETED,    // Pending order registered, result stored
    FAILED        // Checkout failed, key may be reused
}
