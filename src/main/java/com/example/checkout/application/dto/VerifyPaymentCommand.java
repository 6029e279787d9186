package com.example.checkout.application.dto;

/**
 * Command carrying a payment callback from the provider.
 */
public record VerifyPaymentCommand(
        String orderId,
        String providerOrderId,
        String providerPaymentId,
        String signature
) {
    public VerifyPaymentCommand {
        requireText(orderId, "orderId");
        requireText(providerOrderId, "providerOrderId");
        requireText(providerPaymentId, "providerPaymentId");
        requireText(signature, "signature");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
