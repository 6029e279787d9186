package com.example.checkout.integration;

import com.example.checkout.infrastructure.persistence.entity.IdempotencyRecord;
import com.example.checkout.infrastructure.persistence.entity.IdempotencyStatus;
import com.example.checkout.infrastructure.service.IdempotencyService;
import com.example.checkout.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for claiming checkout idempotency keys against a real database,
 * including claims that race each other.
 */
@DisplayName("Idempotency Claim Integration Tests")
class IdempotencyClaimIntegrationTest extends WireMockTestSupport {

    private static final int CLAIMANTS = 8;

    @Autowired
    private IdempotencyService idempotencyService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Nested
    @DisplayName("Single claims")
    class SingleClaims {

        @Test
        @DisplayName("should claim a fresh key once")
        void should_claim_fresh_key_once() {
            assertThat(idempotencyService.markInProgress(USER_ID, "key-1")).isTrue();
            assertThat(idempotencyService.markInProgress(USER_ID, "key-1")).isFalse();

            assertThat(idempotencyRepository.findById(IdempotencyRecord.scope(USER_ID, "key-1")))
                    .get()
                    .extracting(IdempotencyRecord::getStatus)
                    .isEqualTo(IdempotencyStatus.IN_PROGRESS);
        }

        @Test
        @DisplayName("should reclaim a key whose attempt failed")
        void should_reclaim_failed_key() {
            idempotencyService.markInProgress(USER_ID, "key-2");
            idempotencyService.markFailed(USER_ID, "key-2");

            assertThat(idempotencyService.markInProgress(USER_ID, "key-2")).isTrue();
            assertThat(idempotencyRepository.findById(IdempotencyRecord.scope(USER_ID, "key-2")))
                    .get()
                    .extracting(IdempotencyRecord::getStatus)
                    .isEqualTo(IdempotencyStatus.IN_PROGRESS);
        }

        @Test
        @DisplayName("should reclaim an expired key")
        void should_reclaim_expired_key() {
            idempotencyRepository.saveAndFlush(
                    new IdempotencyRecord(USER_ID, "key-3", Instant.now().minusSeconds(60)));

            assertThat(idempotencyService.markInProgress(USER_ID, "key-3")).isTrue();
            assertThat(idempotencyRepository.findById(IdempotencyRecord.scope(USER_ID, "key-3")))
                    .get()
                    .satisfies(record -> assertThat(record.getExpiresAt()).isAfter(Instant.now()));
        }
    }

    @Nested
    @DisplayName("Racing claims")
    class RacingClaims {

        @Test
        @DisplayName("should let exactly one of many concurrent claims of a fresh key win")
        void should_grant_fresh_key_to_one_claimant() throws Exception {
            assertThat(raceFor("race-key")).isEqualTo(1);
            assertThat(idempotencyRepository.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should let exactly one of many concurrent retries reclaim a failed key")
        void should_grant_failed_key_to_one_claimant() throws Exception {
            idempotencyService.markInProgress(USER_ID, "retry-key");
            idempotencyService.markFailed(USER_ID, "retry-key");

            assertThat(raceFor("retry-key")).isEqualTo(1);
        }

        @Test
        @DisplayName("should refuse a key another transaction is still inserting without failing")
        void should_refuse_key_held_by_uncommitted_insert() throws Exception {
            CountDownLatch inserted = new CountDownLatch(1);
            TransactionTemplate transaction = new TransactionTemplate(transactionManager);

            CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> transaction.executeWithoutResult(status -> {
                idempotencyRepository.saveAndFlush(
                        new IdempotencyRecord(USER_ID, "held-key", Instant.now().plusSeconds(3600)));
                inserted.countDown();
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));

            assertThat(inserted.await(5, TimeUnit.SECONDS)).isTrue();
            boolean claimed = idempotencyService.markInProgress(USER_ID, "held-key");
            holder.get(15, TimeUnit.SECONDS);

            assertThat(claimed).isFalse();
            assertThat(idempotencyRepository.count()).isEqualTo(1);
        }
    }

    private long raceFor(String clientKey) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(CLAIMANTS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> claims = new ArrayList<>();
            for (int i = 0; i < CLAIMANTS; i++) {
                claims.add(executor.submit(() -> {
                    start.await();
                    return idempotencyService.markInProgress(USER_ID, clientKey);
                }));
            }
            start.countDown();

            long granted = 0;
            for (Future<Boolean> claim : claims) {
                if (claim.get(20, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            return granted;
        } finally {
            executor.shutdownNow();
        }
    }
}
