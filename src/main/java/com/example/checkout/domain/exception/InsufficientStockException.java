package com.example.checkout.domain.exception;

import com.example.checkout.domain.model.ProductId;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when one or more products cannot cover the requested quantity.
 */
public class InsufficientStockException extends DomainException {

    private final List<Shortage> shortages;

    public InsufficientStockException(ProductId productId, int requestedQuantity, int availableQuantity) {
        this(List.of(new Shortage(productId, null, requestedQuantity, availableQuantity)));
    }

    public InsufficientStockException(List<Shortage> shortages) {
        super(shortages.stream()
                .map(Shortage::describe)
                .collect(Collectors.joining("; ", "Insufficient stock: ", "")));
        this.shortages = List.copyOf(shortages);
    }

    public List<Shortage> getShortages() {
        return shortages;
    }

    /**
     * One product that cannot cover its requested quantity.
     *
     * @param productId         the product
     * @param productName       product name when known, otherwise null
     * @param requestedQuantity quantity asked for
     * @param availableQuantity stock observed at the time of the check
     */
    public record Shortage(ProductId productId, String productName, int requestedQuantity, int availableQuantity) {

        String describe() {
            String label = productName != null ? productName : productId.getValue();
            if (availableQuantity <= 0) {
                return label + " is out of stock";
            }
            return String.format("Only %d available for %s (requested %d)",
                    availableQuantity, label, requestedQuantity);
        }
    }
}
