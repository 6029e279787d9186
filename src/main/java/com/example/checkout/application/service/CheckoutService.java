package com.example.checkout.application.service;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.dto.CheckoutCommand.LineRequest;
import com.example.checkout.application.dto.CheckoutResult;
import com.example.checkout.application.port.in.CheckoutUseCase;
import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.application.port.out.CatalogPort.CatalogProduct;
import com.example.checkout.application.port.out.InventoryPort;
import com.example.checkout.application.port.out.InventoryPort.Availability;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.application.port.out.PaymentProviderPort;
import com.example.checkout.domain.exception.InsufficientStockException;
import com.example.checkout.domain.exception.InsufficientStockException.Shortage;
import com.example.checkout.domain.exception.ProductNotFoundException;
import com.example.checkout.domain.exception.ProviderUnavailableException;
import com.example.checkout.domain.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Application service that orchestrates checkout:
 * availability pre-check → pending order → provider registration → provider reference.
 * <p>
 * The availability check is advisory. Stock is only taken when the payment is verified.
 */
@Service
public class CheckoutService implements CheckoutUseCase {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final CatalogPort catalogPort;
    private final InventoryPort inventoryPort;
    private final CartPort cartPort;
    private final PaymentProviderPort paymentProviderPort;
    private final OrderStorePort orderStore;
    private final String storeCurrency;

    public CheckoutService(
            CatalogPort catalogPort,
            InventoryPort inventoryPort,
            CartPort cartPort,
            PaymentProviderPort paymentProviderPort,
            OrderStorePort orderStore,
            @Value("${checkout.currency:INR}") String storeCurrency) {
        this.catalogPort = catalogPort;
        this.inventoryPort = inventoryPort;
        this.cartPort = cartPort;
        this.paymentProviderPort = paymentProviderPort;
        this.orderStore = orderStore;
        this.storeCurrency = storeCurrency;
    }

    @Override
    public CompletableFuture<CheckoutResult> checkout(CheckoutCommand command) {
        String currency = resolveCurrency(command.currency());
        log.info("Checkout requested by user {} with {} explicit items", command.userId(), command.items().size());

        CompletableFuture<List<LineRequest>> lines = command.items().isEmpty()
                ? loadCart(command.userId())
                : CompletableFuture.completedFuture(command.items());

        return lines
                .thenApply(requested -> createPendingOrder(command, mergeLines(requested), currency))
                .thenCompose(this::registerWithProvider);
    }

    private CompletableFuture<List<LineRequest>> loadCart(String userId) {
        log.debug("No explicit items, reading cart of user {}", userId);
        return cartPort.getCart(userId)
                .thenApply(cartItems -> cartItems.stream()
                        .map(item -> new LineRequest(item.productId(), item.quantity()))
                        .toList());
    }

    /**
     * Sums quantities of repeated products, keeping first-seen order.
     */
    private List<LineRequest> mergeLines(List<LineRequest> requested) {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        for (LineRequest line : requested) {
            quantities.merge(line.productId(), line.quantity(), Integer::sum);
        }
        if (quantities.isEmpty()) {
            throw new IllegalArgumentException("No items to check out");
        }
        return quantities.entrySet().stream()
                .map(entry -> new LineRequest(entry.getKey(), entry.getValue()))
                .toList();
    }

    private Order createPendingOrder(CheckoutCommand command, List<LineRequest> lines, String currency) {
        List<LineItem> items = new ArrayList<>();
        List<Shortage> shortages = new ArrayList<>();

        for (LineRequest line : lines) {
            ProductId productId = ProductId.of(line.productId());
            CatalogProduct product = catalogPort.getProduct(productId)
                    .orElseThrow(() -> new ProductNotFoundException(productId));

            Availability availability = inventoryPort.checkAvailability(productId, line.quantity());
            if (!availability.available()) {
                shortages.add(new Shortage(productId, product.name(), line.quantity(), availability.currentStock()));
                continue;
            }

            // Price comes from the catalog, never from the client
            ProductSnapshot snapshot = new ProductSnapshot(
                    productId, product.name(), Money.of(product.price(), currency), product.category());
            items.add(LineItem.of(snapshot, line.quantity()));
        }

        if (!shortages.isEmpty()) {
            throw new InsufficientStockException(shortages);
        }

        Order order = orderStore.create(Order.create(command.userId(), items, command.shippingAddress(), currency));
        log.info("Pending order {} created for user {}, total {}",
                order.getOrderId(), order.getUserId(), order.getTotalAmount());
        return order;
    }

    private CompletableFuture<CheckoutResult> registerWithProvider(Order order) {
        String receipt = order.getOrderId().toReceipt();

        return paymentProviderPort.createProviderOrder(order.getTotalAmount(), receipt)
                .handle((providerOrder, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                                ? throwable.getCause()
                                : throwable;
                        log.warn("Provider registration failed for order {}, order stays pending: {}",
                                order.getOrderId(), cause.getMessage());
                        throw new ProviderUnavailableException(order.getOrderId(),
                                "Payment provider unavailable, please retry checkout", cause);
                    }

                    if (!orderStore.attachProviderOrder(order.getOrderId(), providerOrder.providerOrderId())) {
                        log.warn("Order {} left pending before provider order {} could be attached",
                                order.getOrderId(), providerOrder.providerOrderId());
                    }
                    order.attachProviderOrder(providerOrder.providerOrderId());
                    log.info("Order {} registered with provider as {}",
                            order.getOrderId(), providerOrder.providerOrderId());
                    return CheckoutResult.registered(order, providerOrder.providerOrderId());
                });
    }

    private String resolveCurrency(String requested) {
        if (requested == null || requested.isBlank()) {
            return storeCurrency;
        }
        String normalized = requested.trim().toUpperCase(Locale.ROOT);
        if (!normalized.equals(storeCurrency)) {
            throw new IllegalArgumentException(
                    "Unsupported currency: " + requested + ". Orders are priced in " + storeCurrency);
        }
        return normalized;
    }
}
