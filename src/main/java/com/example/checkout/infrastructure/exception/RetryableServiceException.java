package com.example.checkout.infrastructure.exception;

/**
 * Downstream 5xx answer. Retried by the {@code paymentProviderRetry} and {@code cartRetry} instances
 * and counted as a failure by the circuit breaker.
 */
public class RetryableServiceException extends DownstreamServiceException {

    public RetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, statusCode, message);
    }
}
