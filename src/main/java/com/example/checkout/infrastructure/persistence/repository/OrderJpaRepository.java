package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.infrastructure.persistence.entity.OrderEntity;
import com.example.checkout.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA Repository for Order entities.
 * Every status write is conditional on the current status and returns the number of rows changed.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    List<OrderEntity> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(OrderStatusEnum status, Instant createdBefore);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.providerOrderId = :providerOrderId, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = :expected")
    int attachProviderOrder(@Param("id") String id,
                            @Param("providerOrderId") String providerOrderId,
                            @Param("expected") OrderStatusEnum expected,
                            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :next, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = :expected")
    int updateStatusIfCurrent(@Param("id") String id,
                              @Param("expected") OrderStatusEnum expected,
                              @Param("next") OrderStatusEnum next,
                              @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :next, o.failureReason = :reason, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = :expected")
    int updateStatusWithReasonIfCurrent(@Param("id") String id,
                                        @Param("expected") OrderStatusEnum expected,
                                        @Param("next") OrderStatusEnum next,
                                        @Param("reason") String reason,
                                        @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :next, o.providerPaymentId = :paymentId, "
            + "o.providerSignature = :signature, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = :expected")
    int recordPaymentIfCurrent(@Param("id") String id,
                               @Param("expected") OrderStatusEnum expected,
                               @Param("next") OrderStatusEnum next,
                               @Param("paymentId") String paymentId,
                               @Param("signature") String signature,
                               @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.status = :next, o.providerPaymentId = :paymentId, "
            + "o.providerSignature = :signature, o.failureReason = :reason, "
            + "o.requiresManualRefund = true, o.updatedAt = :now "
            + "WHERE o.id = :id AND o.status = :expected")
    int cancelForRefundIfCurrent(@Param("id") String id,
                                 @Param("expected") OrderStatusEnum expected,
                                 @Param("next") OrderStatusEnum next,
                                 @Param("paymentId") String paymentId,
                                 @Param("signature") String signature,
                                 @Param("reason") String reason,
                                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.providerPaymentId = :paymentId, o.providerSignature = :signature, "
            + "o.updatedAt = :now WHERE o.id = :id AND o.status = :expected")
    int recordPaymentAttemptIfCurrent(@Param("id") String id,
                                      @Param("expected") OrderStatusEnum expected,
                                      @Param("paymentId") String paymentId,
                                      @Param("signature") String signature,
                                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderEntity o SET o.requiresManualRefund = true, "
            + "o.providerPaymentId = COALESCE(o.providerPaymentId, :paymentId), "
            + "o.failureReason = COALESCE(o.failureReason, :reason), o.updatedAt = :now "
            + "WHERE o.id = :id")
    int flagManualRefund(@Param("id") String id,
                         @Param("paymentId") String paymentId,
                         @Param("reason") String reason,
                         @Param("now") Instant now);
}
