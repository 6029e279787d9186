package com.example.checkout.infrastructure.exception;

/**
 * Raised by adapter fallbacks once retries are exhausted, the circuit is open or the call timed out.
 */
public class ServiceUnavailableException extends RuntimeException {

    private final String serviceName;

    public ServiceUnavailableException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
