package com.example.checkout.infrastructure.persistence;

import com.example.checkout.application.port.out.InventoryPort;
import com.example.checkout.domain.exception.InsufficientStockException;
import com.example.checkout.domain.exception.ProductNotFoundException;
import com.example.checkout.domain.model.ProductId;
import com.example.checkout.infrastructure.persistence.entity.ProductEntity;
import com.example.checkout.infrastructure.persistence.repository.ProductJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Inventory ledger over the products table.
 * <p>
 * Commit and restore are single conditional UPDATE statements; the product row is only
 * read afterwards to explain why a statement changed nothing.
 */
@Service
public class InventoryLedgerService implements InventoryPort {

    private static final Logger log = LoggerFactory.getLogger(InventoryLedgerService.class);

    private final ProductJpaRepository productRepository;

    public InventoryLedgerService(ProductJpaRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Availability checkAvailability(ProductId productId, int quantity) {
        ProductEntity product = productRepository.findById(productId.getValue())
                .orElseThrow(() -> new ProductNotFoundException(productId));
        if (!product.isTrackInventory()) {
            return new Availability(true, product.getStock(), false);
        }
        return new Availability(product.getStock() >= quantity, product.getStock(), true);
    }

    @Override
    @Transactional
    public StockLevel commit(ProductId productId, int quantity) {
        requirePositive(quantity);
        int updated = productRepository.decreaseStock(productId.getValue(), quantity, Instant.now());

        Optional<ProductEntity> product = productRepository.findById(productId.getValue());
        if (product.isEmpty()) {
            log.warn("Commit of {} x {} failed, product no longer exists", quantity, productId);
            throw new InsufficientStockException(productId, quantity, 0);
        }
        ProductEntity current = product.get();

        if (!current.isTrackInventory()) {
            log.debug("Product {} does not track inventory, commit of {} skipped", productId, quantity);
            return StockLevel.untracked(productId);
        }
        if (updated == 0) {
            log.warn("Insufficient stock for {}: requested {}, available {}", productId, quantity, current.getStock());
            throw new InsufficientStockException(productId, quantity, current.getStock());
        }

        log.debug("Committed {} x {}, remaining stock {}", quantity, productId, current.getStock());
        return new StockLevel(productId, current.getStock(), current.getLowStockThreshold(), true);
    }

    @Override
    @Transactional
    public void restore(ProductId productId, int quantity) {
        requirePositive(quantity);
        int updated = productRepository.increaseStock(productId.getValue(), quantity, Instant.now());
        if (updated == 1) {
            log.debug("Restored {} x {}", quantity, productId);
            return;
        }
        if (productRepository.existsById(productId.getValue())) {
            log.debug("Product {} does not track inventory, restore of {} skipped", productId, quantity);
        } else {
            log.warn("Restore of {} x {} skipped, product no longer exists", quantity, productId);
        }
    }

    private static void requirePositive(int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("Quantity must be at least 1, got: " + quantity);
        }
    }
}
