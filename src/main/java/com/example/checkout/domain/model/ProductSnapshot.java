package com.example.checkout.domain.model;

import java.util.Objects;

/**
 * Product details frozen onto a line item when the order is created.
 * Later catalog edits never reach an existing order.
 *
 * @param productId the catalog product id
 * @param name      product name at order time
 * @param unitPrice unit price at order time
 * @param category  product category at order time, may be null
 */
public record ProductSnapshot(ProductId productId, String name, Money unitPrice, String category) {

    public ProductSnapshot {
        Objects.requireNonNull(productId, "ProductId cannot be null");
        Objects.requireNonNull(unitPrice, "Unit price cannot be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Product name is required for " + productId);
        }
    }
}
