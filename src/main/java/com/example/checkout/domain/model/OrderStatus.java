package com.example.checkout.domain.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Enum representing the possible states of an Order and the transitions between them.
 */
public enum OrderStatus {

    /**
     * Created at checkout, awaiting payment confirmation. No stock committed.
     */
    PENDING,

    /**
     * Payment verified and stock committed for every line item.
     */
    CONFIRMED,

    /**
     * Being prepared for shipment.
     */
    PROCESSING,

    /**
     * Handed over to the carrier.
     */
    SHIPPED,

    /**
     * Received by the customer. Terminal.
     */
    DELIVERED,

    /**
     * Cancelled before delivery. Terminal.
     */
    CANCELLED;

    /**
     * Returns the statuses this status may move to.
     *
     * @return allowed next statuses, empty for terminal statuses
     */
    public Set<OrderStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(CONFIRMED, CANCELLED);
            case CONFIRMED -> EnumSet.of(PROCESSING, CANCELLED);
            case PROCESSING -> EnumSet.of(SHIPPED, CANCELLED);
            case SHIPPED -> EnumSet.of(DELIVERED, CANCELLED);
            case DELIVERED, CANCELLED -> EnumSet.noneOf(OrderStatus.class);
        };
    }

    public boolean canTransitionTo(OrderStatus next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    /**
     * Whether an order in this status has had its stock committed and not yet restored.
     *
     * @return true for confirmed, processing and shipped
     */
    public boolean holdsCommittedStock() {
        return this == CONFIRMED || this == PROCESSING || this == SHIPPED;
    }

    /**
     * Lower-case name used on the wire ("pending", "shipped", ...).
     *
     * @return the wire name
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire name, case-insensitively.
     *
     * @param value the status name
     * @return the matching status
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static OrderStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Order status is required");
        }
        try {
            return OrderStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown order status: " + value, e);
        }
    }
}
