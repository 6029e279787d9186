package com.example.checkout.infrastructure.exception;

/**
 * Downstream 4xx answer: the request itself was refused, so repeating it cannot help.
 * Listed under {@code ignore-exceptions} of the retry instances.
 */
public class NonRetryableServiceException extends DownstreamServiceException {

    public NonRetryableServiceException(String serviceName, int statusCode, String message) {
        super(serviceName, statusCode, message);
    }
}
