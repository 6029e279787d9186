package com.example.checkout.domain.model;

import com.example.checkout.domain.exception.InvalidTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate Root representing a customer order.
 * Line items are frozen at creation; only status, payment references and
 * failure bookkeeping change afterwards.
 */
public final class Order {

    private final OrderId orderId;
    private final String userId;
    private final List<LineItem> items;
    private final String currency;
    private final ShippingAddress shippingAddress;
    private final Instant createdAt;
    private Instant updatedAt;
    private OrderStatus status;
    private PaymentReference paymentReference;
    private String failureReason;
    private boolean requiresManualRefund;

    private Order(OrderId orderId, String userId, List<LineItem> items, String currency,
                  ShippingAddress shippingAddress, Instant createdAt, Instant updatedAt,
                  OrderStatus status, PaymentReference paymentReference,
                  String failureReason, boolean requiresManualRefund) {
        this.orderId = Objects.requireNonNull(orderId, "OrderId cannot be null");
        this.userId = Objects.requireNonNull(userId, "UserId cannot be null");
        this.items = new ArrayList<>(Objects.requireNonNull(items, "Items cannot be null"));
        this.currency = Objects.requireNonNull(currency, "Currency cannot be null");
        this.shippingAddress = Objects.requireNonNull(shippingAddress, "ShippingAddress cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        this.updatedAt = updatedAt != null ? updatedAt : createdAt;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.paymentReference = paymentReference != null ? paymentReference : PaymentReference.none();
        this.failureReason = failureReason;
        this.requiresManualRefund = requiresManualRefund;

        if (userId.isBlank()) {
            throw new IllegalArgumentException("UserId cannot be blank");
        }
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Order must have at least one item");
        }
        for (LineItem item : items) {
            if (!currency.equals(item.getProduct().unitPrice().getCurrency())) {
                throw new IllegalArgumentException(
                        "Line item " + item.getProductId() + " is priced in "
                                + item.getProduct().unitPrice().getCurrency() + ", order currency is " + currency);
            }
        }
    }

    /**
     * Creates a new pending Order.
     *
     * @param userId          the owning user
     * @param items           the line items with server-side price snapshots (must not be empty)
     * @param shippingAddress the shipping address snapshot
     * @param currency        the order currency
     * @return new Order in {@link OrderStatus#PENDING}
     */
    public static Order create(String userId, List<LineItem> items,
                               ShippingAddress shippingAddress, String currency) {
        Instant now = Instant.now();
        return new Order(
                OrderId.generate(),
                userId,
                items,
                currency,
                shippingAddress,
                now,
                now,
                OrderStatus.PENDING,
                PaymentReference.none(),
                null,
                false
        );
    }

    /**
     * Reconstitutes an Order from persistence.
     */
    public static Order reconstitute(OrderId orderId, String userId, List<LineItem> items, String currency,
                                     ShippingAddress shippingAddress, Instant createdAt, Instant updatedAt,
                                     OrderStatus status, PaymentReference paymentReference,
                                     String failureReason, boolean requiresManualRefund) {
        return new Order(orderId, userId, items, currency, shippingAddress, createdAt, updatedAt,
                status, paymentReference, failureReason, requiresManualRefund);
    }

    /**
     * Calculates the total amount for this order.
     *
     * @return the sum of all line totals
     */
    public Money getTotalAmount() {
        return items.stream()
                .map(LineItem::getTotalPrice)
                .reduce(Money.zero(currency), Money::add);
    }

    /**
     * Moves the order to a new status if the transition table allows it.
     *
     * @param next the target status
     * @return the status the order was in before the transition
     * @throws InvalidTransitionException if the transition is not allowed
     */
    public OrderStatus transitionTo(OrderStatus next) {
        Objects.requireNonNull(next, "Next status cannot be null");
        if (!status.canTransitionTo(next)) {
            throw new InvalidTransitionException(orderId, status, next);
        }
        OrderStatus previous = this.status;
        this.status = next;
        this.updatedAt = Instant.now();
        return previous;
    }

    /**
     * Cancels the order and records why.
     *
     * @param reason the failure or cancellation reason
     * @return the status the order was in before cancellation
     * @throws InvalidTransitionException if the order is already terminal
     */
    public OrderStatus cancel(String reason) {
        OrderStatus previous = transitionTo(OrderStatus.CANCELLED);
        this.failureReason = reason;
        return previous;
    }

    /**
     * Records the provider order created for this order.
     *
     * @param providerOrderId the provider's order id
     */
    public void attachProviderOrder(String providerOrderId) {
        if (providerOrderId == null || providerOrderId.isBlank()) {
            throw new IllegalArgumentException("Provider order id is required");
        }
        this.paymentReference = new PaymentReference(providerOrderId, null, null);
        this.updatedAt = Instant.now();
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId.equals(candidateUserId);
    }

    /**
     * Whether this order already settled the given provider payment.
     * A payment id stored on a pending order is only an attempt and does not count.
     *
     * @param providerPaymentId the provider payment id
     * @return true if the order left pending with this payment id recorded
     */
    public boolean isPaidWith(String providerPaymentId) {
        return status != OrderStatus.PENDING
                && providerPaymentId != null
                && providerPaymentId.equals(paymentReference.providerPaymentId());
    }

    /**
     * A payment was captured for this order but confirmation never completed.
     */
    public boolean hasUnconfirmedPayment() {
        return status == OrderStatus.PENDING && paymentReference.providerPaymentId() != null;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public String getUserId() {
        return userId;
    }

    public List<LineItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public String getCurrency() {
        return currency;
    }

    public ShippingAddress getShippingAddress() {
        return shippingAddress;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public PaymentReference getPaymentReference() {
        return paymentReference;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public boolean isRequiresManualRefund() {
        return requiresManualRefund;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return Objects.equals(orderId, order.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId);
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderId=" + orderId +
                ", status=" + status +
                ", itemCount=" + items.size() +
                ", totalAmount=" + getTotalAmount() +
                '}';
    }
}
