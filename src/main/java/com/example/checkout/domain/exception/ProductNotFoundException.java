package com.example.checkout.domain.exception;

import com.example.checkout.domain.model.ProductId;

/**
 * Exception thrown when a checkout line references a product the catalog does not know.
 */
public class ProductNotFoundException extends DomainException {

    private final ProductId productId;

    public ProductNotFoundException(ProductId productId) {
        super("Product not found: " + productId);
        this.productId = productId;
    }

    public ProductId getProductId() {
        return productId;
    }
}
