package com.example.checkout.infrastructure.notification;

import com.example.checkout.infrastructure.persistence.entity.NotificationEntity;
import com.example.checkout.infrastructure.persistence.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operator inbox over recorded notifications.
 */
@Service
public class NotificationInboxService {

    private static final Logger log = LoggerFactory.getLogger(NotificationInboxService.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final NotificationRepository repository;
    private final ObjectMapper objectMapper;

    public NotificationInboxService(NotificationRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * Lists notifications, newest first.
     *
     * @param unreadOnly only return unread notifications
     * @param limit      maximum number returned
     * @return the notifications
     */
    @Transactional(readOnly = true)
    public List<NotificationView> list(boolean unreadOnly, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 200)));
        List<NotificationEntity> entities = unreadOnly
                ? repository.findByReadFalseOrderByCreatedAtDesc(page)
                : repository.findAllByOrderByCreatedAtDesc(page);
        return entities.stream().map(this::toView).toList();
    }

    /**
     * Marks a notification as read.
     *
     * @param id the notification id
     * @return true if the notification exists
     */
    @Transactional
    public boolean markRead(Long id) {
        return repository.markRead(id) == 1;
    }

    private NotificationView toView(NotificationEntity entity) {
        return new NotificationView(
                entity.getId(),
                entity.getType().name(),
                entity.getMessage(),
                entity.getOrderId(),
                entity.isRead(),
                parseMetadata(entity),
                entity.getCreatedAt());
    }

    private Map<String, Object> parseMetadata(NotificationEntity entity) {
        if (entity.getMetadata() == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(entity.getMetadata(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on notification {}: {}", entity.getId(), e.getMessage());
            return Map.of();
        }
    }

    /**
     * Notification as shown to operators.
     */
    public record NotificationView(
            Long id,
            String type,
            String message,
            String orderId,
            boolean read,
            Map<String, Object> metadata,
            Instant createdAt
    ) {
    }
}
