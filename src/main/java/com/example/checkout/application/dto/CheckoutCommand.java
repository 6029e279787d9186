package com.example.checkout.application.dto;

import com.example.checkout.domain.model.ShippingAddress;

import java.util.List;
import java.util.Objects;

/**
 * Command for starting a checkout.
 * An empty item list means "check out the user's cart".
 */
public record CheckoutCommand(
        String userId,
        List<LineRequest> items,
        ShippingAddress shippingAddress,
        String currency
) {
    public CheckoutCommand {
        Objects.requireNonNull(shippingAddress, "ShippingAddress cannot be null");
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("UserId cannot be blank");
        }
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Canonical line request, whichever shape the client sent.
     */
    public record LineRequest(
            String productId,
            int quantity
    ) {
        public LineRequest {
            if (productId == null || productId.isBlank()) {
                throw new IllegalArgumentException("Each item needs a productId or product._id");
            }
            if (quantity < 1) {
                throw new IllegalArgumentException("Quantity must be at least 1 for product " + productId);
            }
        }
    }
}
