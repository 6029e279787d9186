package com.example.checkout.infrastructure.exception;

/**
 * Failure answered by a downstream HTTP service (payment provider, cart).
 * Subclasses decide whether the resilience layer may try again.
 */
public abstract class DownstreamServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;

    protected DownstreamServiceException(String serviceName, int statusCode, String message) {
        super(message);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * HTTP status returned by the downstream service.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
