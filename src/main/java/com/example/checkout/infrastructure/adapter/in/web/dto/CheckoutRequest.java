package com.example.checkout.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for POST /api/checkout.
 * Omitting {@code items} checks out the caller's cart.
 */
public record CheckoutRequest(
        @Valid
        @Size(max = 100, message = "At most 100 line items per checkout")
        List<LineItemRequest> items,

        @NotNull(message = "Shipping address is required")
        @Valid
        ShippingAddressRequest shippingAddress,

        String currency
) {
    /**
     * A line references its product by {@code productId} or by a {@code product} object with {@code _id}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LineItemRequest(
            String productId,

            ProductReference product,

            @Positive(message = "Quantity must be positive")
            Integer quantity
    ) {
        public String resolvedProductId() {
            if (productId != null && !productId.isBlank()) {
                return productId;
            }
            return product != null ? product.id() : null;
        }

        public int resolvedQuantity() {
            return quantity != null ? quantity : 1;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProductReference(@JsonProperty("_id") String id) {
    }

    public record ShippingAddressRequest(
            @NotBlank(message = "Street is required") String street,
            @NotBlank(message = "City is required") String city,
            @NotBlank(message = "State is required") String state,
            @NotBlank(message = "Country is required") String country,
            @NotBlank(message = "Zip code is required") String zipCode,
            String phone
    ) {
    }
}
