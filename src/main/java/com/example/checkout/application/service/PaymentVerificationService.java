package com.example.checkout.application.service;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.dto.VerificationResult;
import com.example.checkout.application.dto.VerifyPaymentCommand;
import com.example.checkout.application.port.in.VerifyPaymentUseCase;
import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.application.port.out.InventoryPort.StockLevel;
import com.example.checkout.application.port.out.NotificationPort;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.application.port.out.PaymentSignaturePort;
import com.example.checkout.application.service.OrderTransitionService.ConfirmationOutcome;
import com.example.checkout.domain.exception.AccessDeniedException;
import com.example.checkout.domain.exception.ConfirmationDeferredException;
import com.example.checkout.domain.exception.InsufficientStockException;
import com.example.checkout.domain.exception.InvalidTransitionException;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.exception.SignatureMismatchException;
import com.example.checkout.domain.model.NotificationType;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trust boundary between the payment provider callback and local order/inventory state.
 * <p>
 * A verified payment confirms the order and commits stock in one transaction. Cart clearing
 * and notifications run afterwards and can never undo the confirmation.
 */
@Service
public class PaymentVerificationService implements VerifyPaymentUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentVerificationService.class);

    static final String SIGNATURE_FAILURE_REASON = "Signature verification failed";
    static final String STOCK_UNAVAILABLE_REASON = "stock unavailable at confirmation";

    private final OrderStorePort orderStore;
    private final PaymentSignaturePort signaturePort;
    private final OrderTransitionService transitions;
    private final CartPort cartPort;
    private final NotificationPort notificationPort;

    public PaymentVerificationService(
            OrderStorePort orderStore,
            PaymentSignaturePort signaturePort,
            OrderTransitionService transitions,
            CartPort cartPort,
            NotificationPort notificationPort) {
        this.orderStore = orderStore;
        this.signaturePort = signaturePort;
        this.transitions = transitions;
        this.cartPort = cartPort;
        this.notificationPort = notificationPort;
    }

    @Override
    public VerificationResult verify(VerifyPaymentCommand command) {
        OrderId orderId = OrderId.of(command.orderId());
        Order order = loadOrder(orderId);

        if (!command.providerOrderId().equals(order.getPaymentReference().providerOrderId())) {
            throw new IllegalArgumentException(
                    "Provider order " + command.providerOrderId() + " does not belong to order " + orderId);
        }

        if (!signaturePort.isValid(command.providerOrderId(), command.providerPaymentId(), command.signature())) {
            rejectSignature(order, command);
        }

        if (order.isPaidWith(command.providerPaymentId())) {
            log.info("Payment {} for order {} already processed", command.providerPaymentId(), orderId);
            return VerificationResult.alreadyProcessed(order);
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            return refundForUnacceptablePayment(order, command);
        }

        ConfirmationOutcome outcome;
        try {
            outcome = transitions.confirmAndCommit(order, command.providerPaymentId(), command.signature());
        } catch (InsufficientStockException e) {
            return cancelUnfulfillable(order, command, e);
        } catch (TransientDataAccessException e) {
            return deferConfirmation(order, command, e);
        }

        if (!outcome.claimed()) {
            return resolveAgainstStoredState(orderId, command);
        }

        runPostConfirmationHooks(order, outcome.stockLevels());
        return VerificationResult.confirmed(order);
    }

    @Override
    public OrderView recordPaymentFailure(String userId, String orderId, String reason) {
        OrderId id = OrderId.of(orderId);
        Order order = loadOrder(id);
        if (!order.isOwnedBy(userId)) {
            throw new AccessDeniedException("Not authorized to update order " + orderId);
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new InvalidTransitionException(id, order.getStatus(), OrderStatus.CANCELLED,
                    "Payment failure can only be recorded for pending orders, order " + orderId
                            + " is " + order.getStatus().wireName());
        }

        String failureReason = "Payment failed: " + (reason == null || reason.isBlank() ? "unknown error" : reason);
        if (!orderStore.compareAndSetStatus(id, OrderStatus.PENDING, OrderStatus.CANCELLED, failureReason)) {
            Order current = loadOrder(id);
            throw new InvalidTransitionException(id, current.getStatus(), OrderStatus.CANCELLED,
                    "Order " + orderId + " changed to " + current.getStatus().wireName() + " meanwhile");
        }

        log.info("Order {} cancelled after client-reported payment failure", id);
        notificationPort.emit(NotificationType.PAYMENT_FAILED, "Payment failed for order " + id, id,
                Map.of("userId", userId, "reason", failureReason));
        return OrderView.from(loadOrder(id));
    }

    private void rejectSignature(Order order, VerifyPaymentCommand command) {
        OrderId orderId = order.getOrderId();
        boolean cancelled = orderStore.compareAndSetStatus(
                orderId, OrderStatus.PENDING, OrderStatus.CANCELLED, SIGNATURE_FAILURE_REASON);
        log.warn("Signature mismatch for order {}, providerPaymentId={}, order cancelled={}",
                orderId, command.providerPaymentId(), cancelled);

        if (cancelled) {
            notificationPort.emit(NotificationType.PAYMENT_FAILED,
                    "Payment signature verification failed for order " + orderId, orderId,
                    Map.of("userId", order.getUserId(),
                            "providerOrderId", command.providerOrderId(),
                            "providerPaymentId", command.providerPaymentId()));
        }
        throw new SignatureMismatchException(orderId);
    }

    /**
     * Keeps the captured payment on the pending order after the confirmation unit gave up,
     * so expiry flags it for refund instead of treating it as unpaid.
     */
    private VerificationResult deferConfirmation(Order order, VerifyPaymentCommand command,
                                                 TransientDataAccessException cause) {
        OrderId orderId = order.getOrderId();
        log.error("[CONFIRMATION_DEFERRED] order={}, providerPaymentId={}, cause={}",
                orderId, command.providerPaymentId(), cause.getMessage());

        boolean recorded;
        try {
            recorded = orderStore.recordPaymentAttempt(orderId, command.providerPaymentId(), command.signature());
        } catch (RuntimeException e) {
            log.error("Payment {} for order {} could not be recorded, callback must be resent",
                    command.providerPaymentId(), orderId, e);
            cause.addSuppressed(e);
            throw new ConfirmationDeferredException(orderId, cause);
        }
        if (!recorded) {
            // Order left pending meanwhile
            return resolveAgainstStoredState(orderId, command);
        }
        throw new ConfirmationDeferredException(orderId, cause);
    }

    private VerificationResult cancelUnfulfillable(Order order, VerifyPaymentCommand command,
                                                   InsufficientStockException cause) {
        OrderId orderId = order.getOrderId();
        if (!orderStore.cancelUnfulfillable(orderId, command.providerPaymentId(), command.signature(),
                STOCK_UNAVAILABLE_REASON)) {
            return resolveAgainstStoredState(orderId, command);
        }

        List<String> shortProducts = cause.getShortages().stream()
                .map(shortage -> shortage.productId().getValue())
                .toList();
        reportManualRefund(order, command, STOCK_UNAVAILABLE_REASON, shortProducts);
        return VerificationResult.unfulfillable(order, OrderStatus.CANCELLED);
    }

    /**
     * Handles a valid payment after losing a race: either the winner recorded this very
     * payment (idempotent success), or the order moved on and the money has to go back.
     */
    private VerificationResult resolveAgainstStoredState(OrderId orderId, VerifyPaymentCommand command) {
        Order current = loadOrder(orderId);
        if (current.isPaidWith(command.providerPaymentId())) {
            log.info("Payment {} for order {} was processed by a concurrent callback",
                    command.providerPaymentId(), orderId);
            return VerificationResult.alreadyProcessed(current);
        }
        return refundForUnacceptablePayment(current, command);
    }

    private VerificationResult refundForUnacceptablePayment(Order order, VerifyPaymentCommand command) {
        String reason = "payment captured while order was " + order.getStatus().wireName();
        orderStore.flagManualRefund(order.getOrderId(), command.providerPaymentId(), reason);
        reportManualRefund(order, command, reason, List.of());
        return VerificationResult.unfulfillable(order, order.getStatus());
    }

    private void reportManualRefund(Order order, VerifyPaymentCommand command, String reason,
                                    List<String> shortProducts) {
        log.error("[MANUAL_REFUND] order={}, providerOrderId={}, providerPaymentId={}, amount={}, reason={}",
                order.getOrderId(), command.providerOrderId(), command.providerPaymentId(),
                order.getTotalAmount(), reason);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("userId", order.getUserId());
        metadata.put("providerOrderId", command.providerOrderId());
        metadata.put("providerPaymentId", command.providerPaymentId());
        metadata.put("amount", order.getTotalAmount().getAmount());
        metadata.put("currency", order.getCurrency());
        metadata.put("reason", reason);
        if (!shortProducts.isEmpty()) {
            metadata.put("shortProducts", shortProducts);
        }
        notificationPort.emit(NotificationType.REQUIRES_MANUAL_REFUND,
                "Payment " + command.providerPaymentId() + " for order " + order.getOrderId()
                        + " requires manual refund: " + reason,
                order.getOrderId(), metadata);
    }

    private void runPostConfirmationHooks(Order order, List<StockLevel> stockLevels) {
        clearCartQuietly(order);

        notificationPort.emit(NotificationType.ORDER_CONFIRMED,
                "New order received: " + order.getOrderId(), order.getOrderId(),
                Map.of("userId", order.getUserId(),
                        "totalAmount", order.getTotalAmount().getAmount(),
                        "currency", order.getCurrency()));

        stockLevels.stream()
                .filter(StockLevel::isLow)
                .forEach(level -> notificationPort.emit(NotificationType.LOW_STOCK,
                        "Low stock for product " + level.productId() + ": " + level.remainingStock() + " left",
                        order.getOrderId(),
                        Map.of("productId", level.productId().getValue(),
                                "stock", level.remainingStock(),
                                "lowStockThreshold", level.lowStockThreshold())));
    }

    private void clearCartQuietly(Order order) {
        try {
            cartPort.clearCart(order.getUserId())
                    .whenComplete((ignored, throwable) -> {
                        if (throwable != null) {
                            log.warn("Cart clear failed for user {} after order {}: {}",
                                    order.getUserId(), order.getOrderId(), throwable.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Cart clear could not be started for user {} after order {}: {}",
                    order.getUserId(), order.getOrderId(), e.getMessage());
        }
    }

    private Order loadOrder(OrderId orderId) {
        return orderStore.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId.getValue()));
    }
}
