package com.example.checkout.infrastructure.adapter.out.cart;

import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.infrastructure.adapter.out.cart.dto.CartResponse;
import com.example.checkout.infrastructure.exception.NonRetryableServiceException;
import com.example.checkout.infrastructure.exception.RetryableServiceException;
import com.example.checkout.infrastructure.exception.ServiceUnavailableException;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the cart service.
 * Uses Retry for transient failures. A missing cart reads as an empty one.
 */
@Component
public class CartServiceAdapter implements CartPort {

    private static final Logger log = LoggerFactory.getLogger(CartServiceAdapter.class);
    private static final String SERVICE_NAME = "cart";

    private final WebClient webClient;

    public CartServiceAdapter(@Qualifier("cartWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @Retry(name = "cartRetry", fallbackMethod = "getCartFallback")
    public CompletableFuture<List<CartItem>> getCart(String userId) {
        log.debug("Reading cart of user {}", userId);

        return webClient.get()
                .uri("/api/cart/{userId}", userId)
                .retrieve()
                .onStatus(CartServiceAdapter::isRejection, response ->
                        Mono.error(new NonRetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(), "Cart request rejected")))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        Mono.error(new RetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(), "Cart service error")))
                .bodyToMono(CartResponse.class)
                .map(this::toCartItems)
                .defaultIfEmpty(List.of())
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.just(List.of()))
                .toFuture();
    }

    @Override
    @Retry(name = "cartRetry", fallbackMethod = "clearCartFallback")
    public CompletableFuture<Void> clearCart(String userId) {
        log.debug("Clearing cart of user {}", userId);

        return webClient.delete()
                .uri("/api/cart/{userId}", userId)
                .retrieve()
                .onStatus(CartServiceAdapter::isRejection, response ->
                        Mono.error(new NonRetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(), "Cart clear rejected")))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        Mono.error(new RetryableServiceException(
                                SERVICE_NAME, response.statusCode().value(), "Cart service error")))
                .toBodilessEntity()
                .then()
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .toFuture();
    }

    private static boolean isRejection(HttpStatusCode status) {
        return status.is4xxClientError() && status.value() != HttpStatus.NOT_FOUND.value();
    }

    private List<CartItem> toCartItems(CartResponse response) {
        return response.safeItems().stream()
                .filter(line -> {
                    if (line.resolvedProductId() == null) {
                        log.warn("Skipping cart line without product reference");
                        return false;
                    }
                    return true;
                })
                .map(line -> new CartItem(line.resolvedProductId(), line.resolvedQuantity()))
                .toList();
    }

    @SuppressWarnings("unused")
    private CompletableFuture<List<CartItem>> getCartFallback(String userId, Throwable throwable) {
        log.error("Cart read failed for user {} after retries: {}", userId, throwable.getMessage());

        if (throwable instanceof NonRetryableServiceException) {
            return CompletableFuture.failedFuture(throwable);
        }
        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME, "Cart service is temporarily unavailable", throwable));
    }

    @SuppressWarnings("unused")
    private CompletableFuture<Void> clearCartFallback(String userId, Throwable throwable) {
        log.warn("Cart clear failed for user {} after retries: {}", userId, throwable.getMessage());
        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME, "Cart service is temporarily unavailable", throwable));
    }
}
