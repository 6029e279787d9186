package com.example.checkout.application.port.out;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the cart service.
 */
public interface CartPort {

    /**
     * Reads the user's cart.
     *
     * @param userId the user
     * @return future containing the cart lines (empty list for an empty cart)
     */
    CompletableFuture<List<CartItem>> getCart(String userId);

    /**
     * Empties the user's cart.
     *
     * @param userId the user
     * @return future completing when the cart service acknowledged the request
     */
    CompletableFuture<Void> clearCart(String userId);

    /**
     * One cart line.
     */
    record CartItem(String productId, int quantity) {
    }
}
