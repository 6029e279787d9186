package com.example.checkout.domain.model;

import java.util.Objects;

/**
 * Value Object representing one product/quantity pair within an order.
 */
public final class LineItem {

    private final ProductSnapshot product;
    private final int quantity;

    private LineItem(ProductSnapshot product, int quantity) {
        this.product = Objects.requireNonNull(product, "Product snapshot cannot be null");
        this.quantity = quantity;
    }

    /**
     * Creates a new LineItem.
     *
     * @param product  the product snapshot taken at order time
     * @param quantity the quantity (must be at least 1)
     * @return new LineItem instance
     * @throws IllegalArgumentException if quantity is less than 1
     */
    public static LineItem of(ProductSnapshot product, int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("Quantity must be at least 1, got: " + quantity);
        }
        return new LineItem(product, quantity);
    }

    /**
     * Calculates the line total (unit price * quantity).
     *
     * @return the line total
     */
    public Money getTotalPrice() {
        return product.unitPrice().times(quantity);
    }

    public ProductSnapshot getProduct() {
        return product;
    }

    public ProductId getProductId() {
        return product.productId();
    }

    public int getQuantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LineItem lineItem = (LineItem) o;
        return quantity == lineItem.quantity && Objects.equals(product, lineItem.product);
    }

    @Override
    public int hashCode() {
        return Objects.hash(product, quantity);
    }

    @Override
    public String toString() {
        return "LineItem{" +
                "productId=" + product.productId() +
                ", quantity=" + quantity +
                ", unitPrice=" + product.unitPrice() +
                '}';
    }
}
