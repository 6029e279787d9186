package com.example.checkout.infrastructure.adapter.out.payment;

import com.example.checkout.application.port.out.PaymentProviderPort;
import com.example.checkout.domain.model.Money;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ProviderOrderRequest;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ProviderOrderResponse;
import com.example.checkout.infrastructure.adapter.out.payment.mapper.PaymentProviderMapper;
import com.example.checkout.infrastructure.exception.NonRetryableServiceException;
import com.example.checkout.infrastructure.exception.RetryableServiceException;
import com.example.checkout.infrastructure.exception.ServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the payment provider's order API.
 * Decorator order: Retry → CircuitBreaker → TimeLimiter → HTTP call.
 * The receipt doubles as the idempotency key, so a retried registration cannot
 * create a second provider order.
 */
@Component
public class PaymentProviderAdapter implements PaymentProviderPort {

    private static final Logger log = LoggerFactory.getLogger(PaymentProviderAdapter.class);
    private static final String SERVICE_NAME = "payment-provider";

    private final WebClient webClient;
    private final PaymentProviderMapper mapper;

    public PaymentProviderAdapter(
            @Qualifier("paymentProviderWebClient") WebClient webClient,
            PaymentProviderMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @TimeLimiter(name = "paymentProviderTL")
    @CircuitBreaker(name = "paymentProviderCB")
    @Retry(name = "paymentProviderRetry", fallbackMethod = "createProviderOrderFallback")
    public CompletableFuture<ProviderOrder> createProviderOrder(Money amount, String receipt) {
        log.debug("Registering {} with payment provider, amount: {}", receipt, amount);

        ProviderOrderRequest request = mapper.toRequest(amount, receipt);

        return webClient.post()
                .uri("/v1/orders")
                .header("Idempotency-Key", receipt)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Payment provider rejected order registration: " + body))))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new RetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Payment provider temporarily unavailable"))))
                .bodyToMono(ProviderOrderResponse.class)
                .map(mapper::toProviderOrder)
                .toFuture();
    }

    /**
     * Fallback when the circuit is open.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<ProviderOrder> createProviderOrderFallback(
            Money amount, String receipt, CallNotPermittedException ex) {

        log.warn("Circuit breaker is OPEN for payment provider, receipt: {}", receipt);

        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME,
                        "Payment provider is temporarily unavailable, please retry shortly", ex));
    }

    /**
     * Fallback when retries are exhausted, the call timed out, or the provider rejected the request.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<ProviderOrder> createProviderOrderFallback(
            Money amount, String receipt, Throwable throwable) {

        log.error("Payment provider registration failed for {}, cause: {}", receipt, throwable.getMessage());

        if (throwable instanceof NonRetryableServiceException) {
            return CompletableFuture.failedFuture(throwable);
        }

        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(SERVICE_NAME,
                        "Payment provider is temporarily unavailable, please retry shortly", throwable));
    }
}
