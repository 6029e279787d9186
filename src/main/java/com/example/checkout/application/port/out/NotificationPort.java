package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.NotificationType;
import com.example.checkout.domain.model.OrderId;

import java.util.Map;

/**
 * Outbound port for the operator notification channel.
 * Implementations are best-effort: they never throw.
 */
public interface NotificationPort {

    /**
     * Records a notification.
     *
     * @param type     the notification type
     * @param message  human readable message
     * @param orderId  related order, may be null
     * @param metadata free-form details, may be empty
     */
    void emit(NotificationType type, String message, OrderId orderId, Map<String, Object> metadata);
}
