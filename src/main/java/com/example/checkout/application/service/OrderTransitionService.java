package com.example.checkout.application.service;

import com.example.checkout.application.port.out.InventoryPort;
import com.example.checkout.application.port.out.InventoryPort.StockLevel;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.domain.exception.InvalidTransitionException;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.model.LineItem;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderStatus;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

/**
 * Transactional units that change order status together with the inventory ledger.
 * <p>
 * Every status change is a conditional write on the stored status, so confirmation
 * and cancellation of the same order can never both win.
 */
@Component
public class OrderTransitionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransitionService.class);
    private static final int MAX_TRANSITION_ATTEMPTS = 3;

    // Product rows are always locked in this order so two orders sharing products cannot deadlock
    private static final Comparator<LineItem> LOCK_ORDER =
            Comparator.comparing(item -> item.getProductId().getValue());

    private final OrderStorePort orderStore;
    private final InventoryPort inventoryPort;
    private final boolean restoreOnShippedCancel;

    public OrderTransitionService(
            OrderStorePort orderStore,
            InventoryPort inventoryPort,
            @Value("${checkout.inventory.restore-on-shipped-cancel:true}") boolean restoreOnShippedCancel) {
        this.orderStore = orderStore;
        this.inventoryPort = inventoryPort;
        this.restoreOnShippedCancel = restoreOnShippedCancel;
    }

    /**
     * Claims a pending order for confirmation and commits stock for every line item.
     * If any line is short, the whole unit rolls back and the order is pending again.
     * Lock conflicts with concurrent confirmations are retried as a whole unit.
     *
     * @param order             the order as last read
     * @param providerPaymentId the captured payment
     * @param providerSignature the verified signature
     * @return the outcome; {@code claimed == false} when another caller already moved the order
     * @throws com.example.checkout.domain.exception.InsufficientStockException if a line cannot be covered
     */
    @Retry(name = "confirmationRetry")
    @Transactional
    public ConfirmationOutcome confirmAndCommit(Order order, String providerPaymentId, String providerSignature) {
        OrderId orderId = order.getOrderId();
        if (!orderStore.claimForConfirmation(orderId, providerPaymentId, providerSignature)) {
            log.info("Confirmation claim lost for order {}", orderId);
            return ConfirmationOutcome.notClaimed();
        }

        List<StockLevel> stockLevels = inLockOrder(order).stream()
                .map(item -> inventoryPort.commit(item.getProductId(), item.getQuantity()))
                .toList();

        log.info("Order {} confirmed, stock committed for {} line items", orderId, stockLevels.size());
        return ConfirmationOutcome.claimed(stockLevels);
    }

    /**
     * Moves an order to a new status, restoring stock when a committed order is cancelled.
     * Re-reads and retries a bounded number of times if the order changed concurrently.
     *
     * @param orderId the order
     * @param next    the target status
     * @param reason  reason recorded on cancellation, ignored otherwise
     * @return the outcome with the updated order
     * @throws OrderNotFoundException     if the order does not exist
     * @throws InvalidTransitionException if the transition table forbids the change
     */
    @Transactional
    public TransitionOutcome transition(OrderId orderId, OrderStatus next, String reason) {
        OrderStatus lastSeen = null;
        for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
            Order order = orderStore.findById(orderId)
                    .orElseThrow(() -> new OrderNotFoundException(orderId.getValue()));
            lastSeen = order.getStatus();

            OrderStatus previous = next == OrderStatus.CANCELLED
                    ? order.cancel(reason)
                    : order.transitionTo(next);

            if (orderStore.compareAndSetStatus(orderId, previous, next,
                    next == OrderStatus.CANCELLED ? reason : null)) {
                boolean restored = next == OrderStatus.CANCELLED && shouldRestore(previous);
                if (restored) {
                    restoreStock(order);
                }
                log.info("Order {} moved from {} to {}{}", orderId, previous.wireName(), next.wireName(),
                        restored ? " (stock restored)" : "");
                return new TransitionOutcome(order, previous, restored);
            }
            log.debug("Order {} changed while moving to {}, attempt {}", orderId, next.wireName(), attempt);
        }
        throw new InvalidTransitionException(orderId, lastSeen, next,
                "Order " + orderId + " changed concurrently, please retry");
    }

    private boolean shouldRestore(OrderStatus previous) {
        if (!previous.holdsCommittedStock()) {
            return false;
        }
        return previous != OrderStatus.SHIPPED || restoreOnShippedCancel;
    }

    private void restoreStock(Order order) {
        for (LineItem item : inLockOrder(order)) {
            inventoryPort.restore(item.getProductId(), item.getQuantity());
        }
    }

    private static List<LineItem> inLockOrder(Order order) {
        return order.getItems().stream()
                .sorted(LOCK_ORDER)
                .toList();
    }

    /**
     * Result of a confirmation attempt.
     */
    public record ConfirmationOutcome(boolean claimed, List<StockLevel> stockLevels) {

        static ConfirmationOutcome claimed(List<StockLevel> stockLevels) {
            return new ConfirmationOutcome(true, stockLevels);
        }

        static ConfirmationOutcome notClaimed() {
            return new ConfirmationOutcome(false, List.of());
        }
    }

    /**
     * Result of a status transition.
     */
    public record TransitionOutcome(Order order, OrderStatus previousStatus, boolean stockRestored) {
    }
}
