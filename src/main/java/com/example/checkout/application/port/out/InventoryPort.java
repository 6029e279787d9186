package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.ProductId;

/**
 * Outbound port for the inventory ledger that owns per-product stock counters.
 */
public interface InventoryPort {

    /**
     * Read-only availability check. Does not reserve anything.
     *
     * @param productId the product
     * @param quantity  the quantity wanted
     * @return availability snapshot
     * @throws com.example.checkout.domain.exception.ProductNotFoundException if the product does not exist
     */
    Availability checkAvailability(ProductId productId, int quantity);

    /**
     * Atomically decrements stock if enough is left. Joins the caller's transaction,
     * so a failure on any line item rolls back every earlier commit of that unit.
     *
     * @param productId the product
     * @param quantity  the quantity to take
     * @return the stock level after the decrement
     * @throws com.example.checkout.domain.exception.InsufficientStockException if stock is short
     */
    StockLevel commit(ProductId productId, int quantity);

    /**
     * Atomically increments stock. Never fails for a missing or untracked product.
     *
     * @param productId the product
     * @param quantity  the quantity to give back
     */
    void restore(ProductId productId, int quantity);

    /**
     * Result of an availability check.
     */
    record Availability(boolean available, int currentStock, boolean tracked) {
    }

    /**
     * Stock remaining after a commit.
     */
    record StockLevel(ProductId productId, int remainingStock, int lowStockThreshold, boolean tracked) {

        public static StockLevel untracked(ProductId productId) {
            return new StockLevel(productId, 0, 0, false);
        }

        public boolean isLow() {
            return tracked && remainingStock <= lowStockThreshold;
        }
    }
}
