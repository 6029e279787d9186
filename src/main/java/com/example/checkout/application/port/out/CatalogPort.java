package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.ProductId;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Outbound port for reading catalog products.
 */
public interface CatalogPort {

    /**
     * Looks up the current catalog entry for a product.
     *
     * @param productId the product
     * @return the product, or empty if it does not exist
     */
    Optional<CatalogProduct> getProduct(ProductId productId);

    /**
     * Catalog view of a product used for line-item snapshots and stock checks.
     */
    record CatalogProduct(
            ProductId productId,
            String name,
            BigDecimal price,
            String category,
            int stock,
            boolean trackInventory
    ) {
    }
}
