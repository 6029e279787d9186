package com.example.checkout.infrastructure.persistence.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * JPA Entity for operator notifications. Append-only apart from the read flag.
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notifications_read_created", columnList = "is_read, created_at"),
    @Index(name = "idx_notifications_order", columnList = "order_id")
})
public class NotificationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "type", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private NotificationTypeEnum type;

    @Column(name = "message", length = 1000, nullable = false)
    private String message;

    @Column(name = "order_id", length = 36)
    private String orderId;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public NotificationTypeEnum getType() {
        return type;
    }

    public void setType(NotificationTypeEnum type) {
        this.type = type;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public boolean isRead() {
        return read;
    }

    public void setRead(boolean read) {
        this.read = read;
    }

    public String getMetadata() {
        return metadata;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
