package com.example.checkout.application.service;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.port.in.OrderLifecycleUseCase;
import com.example.checkout.application.port.out.NotificationPort;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.application.service.OrderTransitionService.TransitionOutcome;
import com.example.checkout.domain.exception.AccessDeniedException;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.model.NotificationType;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application service for cancellations, operator status changes and stale order expiry.
 */
@Service
public class OrderLifecycleService implements OrderLifecycleUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

    static final String CUSTOMER_CANCEL_REASON = "Cancelled by customer";
    static final String OPERATOR_CANCEL_REASON = "Cancelled by operator";
    static final String EXPIRED_REASON = "Expired: payment not completed";
    static final String UNCONFIRMED_PAYMENT_REASON = "payment captured but confirmation never completed";

    private final OrderStorePort orderStore;
    private final OrderTransitionService transitions;
    private final NotificationPort notificationPort;

    public OrderLifecycleService(
            OrderStorePort orderStore,
            OrderTransitionService transitions,
            NotificationPort notificationPort) {
        this.orderStore = orderStore;
        this.transitions = transitions;
        this.notificationPort = notificationPort;
    }

    @Override
    public OrderView cancel(String userId, String orderId) {
        OrderId id = OrderId.of(orderId);
        Order order = orderStore.findById(id)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.isOwnedBy(userId)) {
            throw new AccessDeniedException("Not authorized to cancel order " + orderId);
        }

        TransitionOutcome outcome = transitions.transition(id, OrderStatus.CANCELLED, CUSTOMER_CANCEL_REASON);
        notifyTransition(outcome, CUSTOMER_CANCEL_REASON);
        return OrderView.from(outcome.order());
    }

    @Override
    public OrderView updateStatus(String orderId, String status) {
        OrderId id = OrderId.of(orderId);
        OrderStatus next = OrderStatus.fromWireName(status);

        TransitionOutcome outcome = transitions.transition(id, next,
                next == OrderStatus.CANCELLED ? OPERATOR_CANCEL_REASON : null);
        notifyTransition(outcome, next == OrderStatus.CANCELLED ? OPERATOR_CANCEL_REASON : null);
        return OrderView.from(outcome.order());
    }

    @Override
    public int expireStalePending(Duration olderThan) {
        List<Order> stale = orderStore.findPendingCreatedBefore(Instant.now().minus(olderThan));
        int expired = 0;
        for (Order order : stale) {
            OrderId id = order.getOrderId();
            if (order.hasUnconfirmedPayment()) {
                holdForRefund(order);
                continue;
            }
            if (!orderStore.compareAndSetStatus(id, OrderStatus.PENDING, OrderStatus.CANCELLED, EXPIRED_REASON)) {
                log.debug("Stale order {} left pending before it could be expired", id);
                continue;
            }
            expired++;
            notificationPort.emit(NotificationType.ORDER_EXPIRED,
                    "Order " + id + " expired without payment", id,
                    Map.of("userId", order.getUserId(), "createdAt", order.getCreatedAt().toString()));
        }
        if (expired > 0) {
            log.info("Expired {} pending orders older than {}", expired, olderThan);
        }
        return expired;
    }

    /**
     * A pending order carrying a captured payment is never expired: the money has to go
     * back, so it is flagged once and left for an operator.
     */
    private void holdForRefund(Order order) {
        if (order.isRequiresManualRefund()) {
            return;
        }
        OrderId id = order.getOrderId();
        String paymentId = order.getPaymentReference().providerPaymentId();
        orderStore.flagManualRefund(id, paymentId, UNCONFIRMED_PAYMENT_REASON);
        log.error("[MANUAL_REFUND] order={}, providerPaymentId={}, reason={}", id, paymentId, UNCONFIRMED_PAYMENT_REASON);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", order.getUserId());
        metadata.put("providerOrderId", order.getPaymentReference().providerOrderId());
        metadata.put("providerPaymentId", paymentId);
        metadata.put("amount", order.getTotalAmount().getAmount());
        metadata.put("currency", order.getCurrency());
        metadata.put("reason", UNCONFIRMED_PAYMENT_REASON);
        notificationPort.emit(NotificationType.REQUIRES_MANUAL_REFUND,
                "Payment " + paymentId + " for order " + id + " requires manual refund: "
                        + UNCONFIRMED_PAYMENT_REASON,
                id, metadata);
    }

    private void notifyTransition(TransitionOutcome outcome, String reason) {
        Order order = outcome.order();
        OrderStatus current = order.getStatus();
        if (current == OrderStatus.CANCELLED) {
            notificationPort.emit(NotificationType.ORDER_CANCELLED,
                    "Order " + order.getOrderId() + " cancelled: " + reason, order.getOrderId(),
                    Map.of("userId", order.getUserId(),
                            "previousStatus", outcome.previousStatus().wireName(),
                            "stockRestored", outcome.stockRestored()));
            return;
        }
        notificationPort.emit(NotificationType.ORDER_STATUS_CHANGED,
                "Order " + order.getOrderId() + " is now " + current.wireName(), order.getOrderId(),
                Map.of("userId", order.getUserId(),
                        "previousStatus", outcome.previousStatus().wireName(),
                        "status", current.wireName()));
    }
}
