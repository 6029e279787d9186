package com.example.checkout.application.port.out;

/**
 * Outbound port that checks payment callback signatures against the server-held secret.
 */
public interface PaymentSignaturePort {

    /**
     * @return true if the signature was produced over the provider order and payment ids
     */
    boolean isValid(String providerOrderId, String providerPaymentId, String signature);
}
