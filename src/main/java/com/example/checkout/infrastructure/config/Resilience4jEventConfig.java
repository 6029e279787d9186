package com.example.checkout.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs resilience events of the outbound calls (payment provider registration, cart reads).
 * Instances created lazily by the annotations are picked up through the registries' entry events.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;

    public Resilience4jEventConfig(
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            TimeLimiterRegistry timeLimiterRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryRegistry = retryRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
    }

    @PostConstruct
    public void registerEventListeners() {
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::onCircuitBreaker);
        circuitBreakerRegistry.getEventPublisher()
                .onEntryAdded(event -> onCircuitBreaker(event.getAddedEntry()));

        retryRegistry.getAllRetries().forEach(this::onRetry);
        retryRegistry.getEventPublisher()
                .onEntryAdded(event -> onRetry(event.getAddedEntry()));

        timeLimiterRegistry.getAllTimeLimiters().forEach(this::onTimeLimiter);
        timeLimiterRegistry.getEventPublisher()
                .onEntryAdded(event -> onTimeLimiter(event.getAddedEntry()));
    }

    private void onCircuitBreaker(CircuitBreaker circuitBreaker) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn(
                        "[CB_STATE] name={}, {} -> {}",
                        event.getCircuitBreakerName(),
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()))
                .onError(event -> log.warn(
                        "[CB_ERROR] name={}, after {}ms: {}",
                        event.getCircuitBreakerName(),
                        event.getElapsedDuration().toMillis(),
                        event.getThrowable().toString()))
                .onCallNotPermitted(event -> log.warn(
                        "[CB_REJECTED] name={}, call short-circuited",
                        event.getCircuitBreakerName()));
    }

    private void onRetry(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.info(
                        "[RETRY] name={}, attempt={}, wait={}ms, cause={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        describe(event.getLastThrowable())))
                .onError(event -> log.error(
                        "[RETRY_EXHAUSTED] name={}, attempts={}, cause={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        describe(event.getLastThrowable())))
                .onIgnoredError(event -> log.debug(
                        "[RETRY_SKIPPED] name={}, non-retryable: {}",
                        event.getName(),
                        describe(event.getLastThrowable())));
    }

    private void onTimeLimiter(TimeLimiter timeLimiter) {
        timeLimiter.getEventPublisher()
                .onTimeout(event -> log.warn(
                        "[TIMEOUT] name={}, call exceeded {}ms",
                        event.getTimeLimiterName(),
                        timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis()));
    }

    private static String describe(Throwable throwable) {
        return throwable != null ? throwable.getClass().getSimpleName() + ": " + throwable.getMessage() : "n/a";
    }
}
