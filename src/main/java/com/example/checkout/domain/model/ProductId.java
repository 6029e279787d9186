package com.example.checkout.domain.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Value Object representing a catalog product identifier.
 * Accepts the catalog's opaque ids (e.g. 24-char hex object ids, slugs like "tea-001").
 */
public final class ProductId {

    private static final Pattern PRODUCT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private final String value;

    private ProductId(String value) {
        this.value = Objects.requireNonNull(value, "ProductId value cannot be null");
    }

    /**
     * Creates a new ProductId with the given value.
     *
     * @param value product identifier
     * @return new ProductId instance
     * @throws IllegalArgumentException if value is blank or contains unsupported characters
     */
    public static ProductId of(String value) {
        if (value == null || !PRODUCT_ID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "Invalid product id: " + value + ". Expected pattern: [A-Za-z0-9_-]{1,64}");
        }
        return new ProductId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductId productId = (ProductId) o;
        return Objects.equals(value, productId.value);
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
