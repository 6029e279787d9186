package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.infrastructure.persistence.entity.IdempotencyRecord;
import com.example.checkout.infrastructure.persistence.entity.IdempotencyStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Checkout idempotency records, keyed by {@link IdempotencyRecord#scope(String, String)}.
 */
@Repository
public interface IdempotencyRepository extends JpaRepository<IdempotencyRecord, String> {

    @Query("SELECT i FROM IdempotencyRecord i WHERE i.scopedKey = :scopedKey AND i.expiresAt > :now")
    Optional<IdempotencyRecord> findLive(@Param("scopedKey") String scopedKey, @Param("now") Instant now);

    /**
     * Takes over a released or expired key in a single statement.
     *
     * @return 1 if this call claimed the key, 0 if it is missing or still held
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IdempotencyRecord i SET i.status = :inProgress, i.resultJson = NULL, i.orderId = NULL, "
            + "i.expiresAt = :newExpiry "
            + "WHERE i.scopedKey = :scopedKey AND (i.status = :failed OR i.expiresAt <= :now)")
    int reclaim(@Param("scopedKey") String scopedKey,
                @Param("inProgress") IdempotencyStatus inProgress,
                @Param("failed") IdempotencyStatus failed,
                @Param("now") Instant now,
                @Param("newExpiry") Instant newExpiry);

    @Modifying
    @Query("DELETE FROM IdempotencyRecord i WHERE i.expiresAt < :before")
    int deleteExpiredBefore(@Param("before") Instant before);
}
