package com.example.checkout.infrastructure.persistence.mapper;

import com.example.checkout.domain.model.*;
import com.example.checkout.infrastructure.persistence.entity.OrderEntity;
import com.example.checkout.infrastructure.persistence.entity.OrderItemEntity;
import com.example.checkout.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.checkout.infrastructure.persistence.entity.ShippingAddressEmbeddable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between domain Order and persistence OrderEntity.
 */
@Component
public class OrderPersistenceMapper {

    public OrderEntity toEntity(Order order) {
        OrderEntity entity = new OrderEntity();
        entity.setId(order.getOrderId().getValue());
        entity.setUserId(order.getUserId());
        entity.setStatus(toStatusEnum(order.getStatus()));
        entity.setTotalAmount(order.getTotalAmount().getAmount());
        entity.setCurrency(order.getCurrency());
        entity.setShippingAddress(toEmbeddable(order.getShippingAddress()));
        entity.setProviderOrderId(order.getPaymentReference().providerOrderId());
        entity.setProviderPaymentId(order.getPaymentReference().providerPaymentId());
        entity.setProviderSignature(order.getPaymentReference().providerSignature());
        entity.setFailureReason(order.getFailureReason());
        entity.setRequiresManualRefund(order.isRequiresManualRefund());
        entity.setCreatedAt(order.getCreatedAt());

        for (LineItem item : order.getItems()) {
            OrderItemEntity itemEntity = new OrderItemEntity();
            itemEntity.setProductId(item.getProductId().getValue());
            itemEntity.setProductName(item.getProduct().name());
            itemEntity.setCategory(item.getProduct().category());
            itemEntity.setUnitPrice(item.getProduct().unitPrice().getAmount());
            itemEntity.setQuantity(item.getQuantity());
            itemEntity.setTotalPrice(item.getTotalPrice().getAmount());
            entity.addItem(itemEntity);
        }

        return entity;
    }

    public Order toDomain(OrderEntity entity) {
        List<LineItem> items = entity.getItems().stream()
                .map(item -> toLineItem(item, entity.getCurrency()))
                .toList();

        return Order.reconstitute(
                OrderId.of(entity.getId()),
                entity.getUserId(),
                items,
                entity.getCurrency(),
                toDomain(entity.getShippingAddress()),
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                toDomainStatus(entity.getStatus()),
                new PaymentReference(
                        entity.getProviderOrderId(),
                        entity.getProviderPaymentId(),
                        entity.getProviderSignature()),
                entity.getFailureReason(),
                entity.isRequiresManualRefund()
        );
    }

    private LineItem toLineItem(OrderItemEntity entity, String currency) {
        ProductSnapshot snapshot = new ProductSnapshot(
                ProductId.of(entity.getProductId()),
                entity.getProductName(),
                Money.of(entity.getUnitPrice(), currency),
                entity.getCategory());
        return LineItem.of(snapshot, entity.getQuantity());
    }

    private ShippingAddressEmbeddable toEmbeddable(ShippingAddress address) {
        ShippingAddressEmbeddable embeddable = new ShippingAddressEmbeddable();
        embeddable.setStreet(address.street());
        embeddable.setCity(address.city());
        embeddable.setState(address.state());
        embeddable.setCountry(address.country());
        embeddable.setZipCode(address.zipCode());
        embeddable.setPhone(address.phone());
        return embeddable;
    }

    private ShippingAddress toDomain(ShippingAddressEmbeddable embeddable) {
        return new ShippingAddress(
                embeddable.getStreet(),
                embeddable.getCity(),
                embeddable.getState(),
                embeddable.getCountry(),
                embeddable.getZipCode(),
                embeddable.getPhone());
    }

    public OrderStatusEnum toStatusEnum(OrderStatus status) {
        return switch (status) {
            case PENDING -> OrderStatusEnum.PENDING;
            case CONFIRMED -> OrderStatusEnum.CONFIRMED;
            case PROCESSING -> OrderStatusEnum.PROCESSING;
            case SHIPPED -> OrderStatusEnum.SHIPPED;
            case DELIVERED -> OrderStatusEnum.DELIVERED;
            case CANCELLED -> OrderStatusEnum.CANCELLED;
        };
    }

    public OrderStatus toDomainStatus(OrderStatusEnum status) {
        return switch (status) {
            case PENDING -> OrderStatus.PENDING;
            case CONFIRMED -> OrderStatus.CONFIRMED;
            case PROCESSING -> OrderStatus.PROCESSING;
            case SHIPPED -> OrderStatus.SHIPPED;
            case DELIVERED -> OrderStatus.DELIVERED;
            case CANCELLED -> OrderStatus.CANCELLED;
        };
    }
}
