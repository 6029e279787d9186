package com.example.checkout.domain.exception;

/**
 * Exception thrown when a caller acts on an order it does not own, or on an operator-only resource.
 */
public class AccessDeniedException extends DomainException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
