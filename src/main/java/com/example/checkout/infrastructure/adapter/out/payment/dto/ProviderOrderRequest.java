package com.example.checkout.infrastructure.adapter.out.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating an order on the payment provider.
 * The amount is in minor currency units.
 */
public record ProviderOrderRequest(
        long amount,
        String currency,
        String receipt,
        @JsonProperty("payment_capture") int paymentCapture
) {
    public static ProviderOrderRequest autoCapture(long amount, String currency, String receipt) {
        return new ProviderOrderRequest(amount, currency, receipt, 1);
    }
}
