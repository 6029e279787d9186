package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.infrastructure.persistence.entity.ProductEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * JPA Repository for products and their stock counters.
 * Stock changes are single conditional statements, never read-modify-write.
 */
@Repository
public interface ProductJpaRepository extends JpaRepository<ProductEntity, String> {

    /**
     * Decrements stock only if enough is left.
     *
     * @return 1 if stock was taken, 0 if the product is missing, untracked or short
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ProductEntity p SET p.stock = p.stock - :quantity, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.trackInventory = true AND p.stock >= :quantity")
    int decreaseStock(@Param("id") String id, @Param("quantity") int quantity, @Param("now") Instant now);

    /**
     * Increments stock of a tracked product.
     *
     * @return 1 if stock was given back, 0 if the product is missing or untracked
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ProductEntity p SET p.stock = p.stock + :quantity, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.trackInventory = true")
    int increaseStock(@Param("id") String id, @Param("quantity") int quantity, @Param("now") Instant now);
}
