package com.example.checkout.infrastructure.adapter.out.cart.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Cart service response. A line references its product either by {@code productId}
 * or by a populated {@code product} object carrying {@code _id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CartResponse(List<CartLine> items) {

    public List<CartLine> safeItems() {
        return items != null ? items : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CartLine(String productId, CartProduct product, Integer quantity) {

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
    public record CartProduct(@JsonProperty("_id") String id) {
    }
}
