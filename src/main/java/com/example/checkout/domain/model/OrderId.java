package com.example.checkout.domain.model;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Order identifier. Canonical lower-case UUID text, also used to derive the provider receipt.
 */
public final class OrderId {

    private static final String RECEIPT_PREFIX = "order_";

    private final String value;

    private OrderId(String value) {
        this.value = value;
    }

    /**
     * Parses an order id received from a client or read from storage.
     *
     * @param value UUID text, any case
     * @return the order id in canonical form
     * @throws IllegalArgumentException if value is missing or not a UUID
     */
    public static OrderId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Order id is required");
        }
        try {
            return new OrderId(UUID.fromString(value.trim()).toString().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid order id: " + value, e);
        }
    }

    public static OrderId generate() {
        return new OrderId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    /**
     * Receipt sent to the payment provider when registering this order ("order_&lt;id&gt;").
     */
    public String toReceipt() {
        return RECEIPT_PREFIX + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderId other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
