package com.example.checkout.infrastructure.persistence;

import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderStatus;
import com.example.checkout.infrastructure.persistence.entity.OrderEntity;
import com.example.checkout.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.checkout.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.checkout.infrastructure.persistence.repository.OrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA-backed order store.
 * Writes join the caller's transaction when there is one, so a status claim and the
 * stock commit that follows it succeed or roll back together.
 */
@Service
@Transactional
public class OrderPersistenceService implements OrderStorePort {

    private static final Logger log = LoggerFactory.getLogger(OrderPersistenceService.class);

    private final OrderJpaRepository orderRepository;
    private final OrderPersistenceMapper mapper;

    public OrderPersistenceService(
            OrderJpaRepository orderRepository,
            OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.mapper = mapper;
    }

    @Override
    public Order create(Order order) {
        OrderEntity saved = orderRepository.save(mapper.toEntity(order));
        log.debug("Saved order entity: {} with {} items", saved.getId(), saved.getItems().size());
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(OrderId orderId) {
        return orderRepository.findById(orderId.getValue())
                .map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findByUserId(String userId) {
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findPendingCreatedBefore(Instant createdBefore) {
        return orderRepository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                        OrderStatusEnum.PENDING, createdBefore).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    public boolean attachProviderOrder(OrderId orderId, String providerOrderId) {
        return orderRepository.attachProviderOrder(
                orderId.getValue(), providerOrderId, OrderStatusEnum.PENDING, Instant.now()) == 1;
    }

    @Override
    public boolean compareAndSetStatus(OrderId orderId, OrderStatus expected, OrderStatus next, String failureReason) {
        int updated = failureReason == null
                ? orderRepository.updateStatusIfCurrent(orderId.getValue(),
                        mapper.toStatusEnum(expected), mapper.toStatusEnum(next), Instant.now())
                : orderRepository.updateStatusWithReasonIfCurrent(orderId.getValue(),
                        mapper.toStatusEnum(expected), mapper.toStatusEnum(next), failureReason, Instant.now());
        if (updated == 0) {
            log.debug("Status of order {} is no longer {}, {} not applied", orderId, expected, next);
        }
        return updated == 1;
    }

    @Override
    public boolean claimForConfirmation(OrderId orderId, String providerPaymentId, String providerSignature) {
        return orderRepository.recordPaymentIfCurrent(orderId.getValue(),
                OrderStatusEnum.PENDING, OrderStatusEnum.CONFIRMED,
                providerPaymentId, providerSignature, Instant.now()) == 1;
    }

    @Override
    public boolean cancelUnfulfillable(OrderId orderId, String providerPaymentId, String providerSignature,
                                       String reason) {
        return orderRepository.cancelForRefundIfCurrent(orderId.getValue(),
                OrderStatusEnum.PENDING, OrderStatusEnum.CANCELLED,
                providerPaymentId, providerSignature, reason, Instant.now()) == 1;
    }

    @Override
    public boolean recordPaymentAttempt(OrderId orderId, String providerPaymentId, String providerSignature) {
        return orderRepository.recordPaymentAttemptIfCurrent(orderId.getValue(), OrderStatusEnum.PENDING,
                providerPaymentId, providerSignature, Instant.now()) == 1;
    }

    @Override
    public void flagManualRefund(OrderId orderId, String providerPaymentId, String reason) {
        if (orderRepository.flagManualRefund(orderId.getValue(), providerPaymentId, reason, Instant.now()) == 0) {
            log.warn("Manual refund flag could not be set, order {} not found", orderId);
        }
    }
}
