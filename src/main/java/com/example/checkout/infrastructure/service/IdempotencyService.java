package com.example.checkout.infrastructure.service;

import com.example.checkout.application.dto.CheckoutResult;
import com.example.checkout.infrastructure.persistence.entity.IdempotencyRecord;
import com.example.checkout.infrastructure.persistence.entity.IdempotencyStatus;
import com.example.checkout.infrastructure.persistence.repository.IdempotencyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Checkout request idempotency.
 * A client retrying POST /api/checkout with the same {@code X-Idempotency-Key} gets the
 * original pending order back instead of a second one.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    private final IdempotencyRepository repository;
    private final ObjectMapper objectMapper;
    private final Duration retention;

    public IdempotencyService(
            IdempotencyRepository repository,
            ObjectMapper objectMapper,
            @Value("${idempotency.expiry-hours:24}") int expiryHours) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.retention = Duration.ofHours(expiryHours);
    }

    /**
     * Looks up the stored result of a completed checkout.
     *
     * @param userId    the caller
     * @param clientKey the idempotency key sent by the caller
     * @return the previous result if found and not expired
     */
    @Transactional(readOnly = true)
    public Optional<CheckoutResult> getExistingResult(String userId, String clientKey) {
        return repository.findLive(IdempotencyRecord.scope(userId, clientKey), Instant.now())
                .filter(record -> record.getStatus() == IdempotencyStatus.COMPLETED)
                .flatMap(record -> {
                    try {
                        return Optional.of(objectMapper.readValue(record.getResultJson(), CheckoutResult.class));
                    } catch (JsonProcessingException e) {
                        log.error("Unreadable checkout result stored under key {}", record.getScopedKey(), e);
                        return Optional.empty();
                    }
                });
    }

    /**
     * Claims the key for a new checkout.
     * Runs without an enclosing transaction: the reclaim and the insert each commit on their
     * own, so a duplicate-key insert only rolls back itself.
     *
     * @return true if claimed, false if a live attempt already holds the key
     */
    public boolean markInProgress(String userId, String clientKey) {
        String scopedKey = IdempotencyRecord.scope(userId, clientKey);
        Instant now = Instant.now();
        Instant expiry = now.plus(retention);

        if (repository.reclaim(scopedKey, IdempotencyStatus.IN_PROGRESS, IdempotencyStatus.FAILED, now, expiry) == 1) {
            log.debug("Idempotency key {} of user {} reclaimed", clientKey, userId);
            return true;
        }
        if (repository.existsById(scopedKey)) {
            log.debug("Idempotency key {} already taken by user {}", clientKey, userId);
            return false;
        }

        try {
            repository.saveAndFlush(new IdempotencyRecord(userId, clientKey, expiry));
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent claim of idempotency key {} by user {}", clientKey, userId);
            return false;
        }
        log.debug("Idempotency key {} of user {} marked in progress", clientKey, userId);
        return true;
    }

    @Transactional
    public void saveResult(String userId, String clientKey, CheckoutResult result) {
        repository.findById(IdempotencyRecord.scope(userId, clientKey))
                .ifPresentOrElse(
                        record -> {
                            try {
                                record.complete(result.orderId(), objectMapper.writeValueAsString(result));
                            } catch (JsonProcessingException e) {
                                log.error("Failed to serialize checkout result for key {}", record.getScopedKey(), e);
                                record.fail();
                            }
                        },
                        () -> log.warn("No idempotency record for key {} of user {}", clientKey, userId)
                );
    }

    /**
     * Releases the key so the client can retry with it.
     */
    @Transactional
    public void markFailed(String userId, String clientKey) {
        repository.findById(IdempotencyRecord.scope(userId, clientKey))
                .ifPresent(IdempotencyRecord::fail);
    }

    @Scheduled(fixedRateString = "${idempotency.cleanup-interval-ms:3600000}")
    @Transactional
    public void cleanupExpiredRecords() {
        int deleted = repository.deleteExpiredBefore(Instant.now());
        if (deleted > 0) {
            log.info("Cleaned up {} expired idempotency records", deleted);
        }
    }
}
