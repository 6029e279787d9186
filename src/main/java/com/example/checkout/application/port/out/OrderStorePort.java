package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outbound port for order persistence.
 * Status changes are conditional writes: they only apply while the stored status
 * still equals the expected one, which serializes confirmation and cancellation per order.
 */
public interface OrderStorePort {

    /**
     * Persists a newly created order.
     */
    Order create(Order order);

    Optional<Order> findById(OrderId orderId);

    List<Order> findByUserId(String userId);

    /**
     * Pending orders created before the given instant, oldest first.
     */
    List<Order> findPendingCreatedBefore(Instant createdBefore);

    /**
     * Records the provider order id on a pending order.
     *
     * @return true if the order was still pending and got updated
     */
    boolean attachProviderOrder(OrderId orderId, String providerOrderId);

    /**
     * Conditionally moves an order from {@code expected} to {@code next}.
     *
     * @param failureReason reason recorded with the change, null keeps the current value
     * @return true if this call performed the change
     */
    boolean compareAndSetStatus(OrderId orderId, OrderStatus expected, OrderStatus next, String failureReason);

    /**
     * Claims a pending order for confirmation, recording the captured payment.
     *
     * @return true if the order was pending and is now confirmed by this call
     */
    boolean claimForConfirmation(OrderId orderId, String providerPaymentId, String providerSignature);

    /**
     * Cancels a pending order whose payment was captured but could not be fulfilled,
     * recording the payment and raising the manual refund flag.
     *
     * @return true if the order was pending and is now cancelled by this call
     */
    boolean cancelUnfulfillable(OrderId orderId, String providerPaymentId, String providerSignature, String reason);

    /**
     * Stores a captured payment on an order that is still pending, so it is not
     * mistaken for an unpaid order later. Does not confirm the order.
     *
     * @return true if the order was pending and got updated
     */
    boolean recordPaymentAttempt(OrderId orderId, String providerPaymentId, String providerSignature);

    /**
     * Raises the manual refund flag without touching status.
     */
    void flagManualRefund(OrderId orderId, String providerPaymentId, String reason);
}
