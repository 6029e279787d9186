package com.example.checkout.infrastructure.reconciliation;

import com.example.checkout.application.port.in.OrderLifecycleUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically cancels pending orders whose payment never completed.
 * Pending orders hold no stock, so expiry has no inventory effect.
 */
@Component
@ConditionalOnProperty(value = "checkout.stale-pending.reaper.enabled", havingValue = "true")
public class StalePendingOrderReaper {

    private static final Logger log = LoggerFactory.getLogger(StalePendingOrderReaper.class);

    private final OrderLifecycleUseCase lifecycle;
    private final Duration threshold;

    public StalePendingOrderReaper(
            OrderLifecycleUseCase lifecycle,
            @Value("${checkout.stale-pending.threshold-minutes:30}") long thresholdMinutes) {
        this.lifecycle = lifecycle;
        this.threshold = Duration.ofMinutes(thresholdMinutes);
    }

    @Scheduled(fixedDelayString = "${checkout.stale-pending.reaper.interval-ms:300000}",
            initialDelayString = "${checkout.stale-pending.reaper.interval-ms:300000}")
    public void expireStalePending() {
        try {
            int expired = lifecycle.expireStalePending(threshold);
            log.debug("Stale pending sweep finished, {} orders expired", expired);
        } catch (RuntimeException e) {
            // Next run retries; a failed sweep must not stop the scheduler
            log.error("Stale pending sweep failed", e);
        }
    }
}
