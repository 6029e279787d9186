package com.example.checkout.infrastructure.persistence.entity;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Checkout attempt registered under a client-supplied idempotency key.
 * Keys are scoped per user: the row id combines the user id and the client key,
 * so two users sending the same key never see each other's orders.
 * New records are always inserted, never merged, so a concurrent claim of the same key
 * fails on the primary key.
 */
@Entity
@Table(name = "checkout_idempotency", indexes = {
    @Index(name = "idx_checkout_idempotency_expires", columnList = "expires_at")
})
public class IdempotencyRecord implements Persistable<String> {

    @Id
    @Column(name = "scoped_key", length = 160)
    private String scopedKey;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "client_key", length = 64, nullable = false)
    private String clientKey;

    @Column(name = "order_id", length = 36)
    private String orderId;

    // Serialized CheckoutResult, set once the attempt completed
    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(name = "status", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private IdempotencyStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Transient
    private boolean isNew = true;

    protected IdempotencyRecord() {
    }

    public IdempotencyRecord(String userId, String clientKey, Instant expiresAt) {
        this.scopedKey = scope(userId, clientKey);
        this.userId = userId;
        this.clientKey = clientKey;
        this.status = IdempotencyStatus.IN_PROGRESS;
        this.expiresAt = expiresAt;
    }

    /**
     * Row id for a user's client key.
     */
    public static String scope(String userId, String clientKey) {
        return userId + ":" + clientKey;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    @PostPersist
    @PostLoad
    protected void markPersisted() {
        isNew = false;
    }

    @Override
    public String getId() {
        return scopedKey;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    public void complete(String orderId, String resultJson) {
        this.orderId = orderId;
        this.resultJson = resultJson;
        this.status = IdempotencyStatus.COMPLETED;
    }

    public void fail() {
        this.status = IdempotencyStatus.FAILED;
    }

    public String getScopedKey() {
        return scopedKey;
    }

    public String getUserId() {
        return userId;
    }

    public String getClientKey() {
        return clientKey;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getResultJson() {
        return resultJson;
    }

    public IdempotencyStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
