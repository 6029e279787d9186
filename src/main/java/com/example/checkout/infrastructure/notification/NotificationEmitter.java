package com.example.checkout.infrastructure.notification;

import com.example.checkout.application.port.out.NotificationPort;
import com.example.checkout.domain.model.NotificationType;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.infrastructure.persistence.entity.NotificationEntity;
import com.example.checkout.infrastructure.persistence.entity.NotificationTypeEnum;
import com.example.checkout.infrastructure.persistence.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Best-effort notification writer.
 * Callers invoke it after their own transaction has committed; any failure here is
 * logged and dropped so it can never undo an order or stock change.
 */
@Component
public class NotificationEmitter implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(NotificationEmitter.class);

    private final NotificationRepository repository;
    private final ObjectMapper objectMapper;

    public NotificationEmitter(NotificationRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public void emit(NotificationType type, String message, OrderId orderId, Map<String, Object> metadata) {
        try {
            NotificationEntity entity = new NotificationEntity();
            entity.setType(NotificationTypeEnum.valueOf(type.name()));
            entity.setMessage(message);
            entity.setOrderId(orderId != null ? orderId.getValue() : null);
            entity.setRead(false);
            entity.setMetadata(serializeMetadata(metadata));

            repository.save(entity);
            log.debug("Notification {} recorded for order {}", type, orderId);
        } catch (RuntimeException e) {
            log.warn("Dropping notification {} for order {}: {}", type, orderId, e.getMessage());
        }
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Notification metadata could not be serialized, storing without it: {}", e.getMessage());
            return null;
        }
    }
}
