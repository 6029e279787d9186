package com.example.checkout.infrastructure.adapter.in.web.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for checkout. Carries what the client needs to open the provider's payment widget.
 */
public record CheckoutResponse(
        String orderId,
        String providerOrderId,
        BigDecimal amount,
        long amountInMinorUnits,
        String currency,
        String providerKeyId,
        String status,
        Instant createdAt
) {
}
