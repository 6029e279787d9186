package com.example.checkout.infrastructure.persistence;

import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.domain.model.ProductId;
import com.example.checkout.infrastructure.persistence.repository.ProductJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Catalog reads served from the local products table.
 */
@Component
public class CatalogPersistenceAdapter implements CatalogPort {

    private final ProductJpaRepository productRepository;

    public CatalogPersistenceAdapter(ProductJpaRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CatalogProduct> getProduct(ProductId productId) {
        return productRepository.findById(productId.getValue())
                .map(product -> new CatalogProduct(
                        productId,
                        product.getName(),
                        product.getPrice(),
                        product.getCategory(),
                        product.getStock(),
                        product.isTrackInventory()));
    }
}
