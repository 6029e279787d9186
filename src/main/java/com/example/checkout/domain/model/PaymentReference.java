package com.example.checkout.domain.model;

/**
 * External payment-provider references carried by an order.
 * Every field is null until the matching step of the payment flow has happened.
 *
 * @param providerOrderId   id returned when the order was registered with the provider
 * @param providerPaymentId id of the captured payment, set on verification
 * @param providerSignature signature delivered with the payment callback
 */
public record PaymentReference(String providerOrderId, String providerPaymentId, String providerSignature) {

    public static PaymentReference none() {
        return new PaymentReference(null, null, null);
    }

    public boolean isRegistered() {
        return providerOrderId != null;
    }
}
