package com.example.checkout.infrastructure.exception;

/**
 * Thrown when a checkout with the same idempotency key is still running.
 */
public class RequestInProgressException extends RuntimeException {

    private final String idempotencyKey;

    public RequestInProgressException(String idempotencyKey) {
        super("Request with idempotency key " + idempotencyKey + " is already being processed");
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
