package com.example.checkout.infrastructure.adapter.out.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response DTO from the payment provider's order endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderOrderResponse(
        String id,
        long amount,
        String currency,
        String receipt,
        String status
) {
}
