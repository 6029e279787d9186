package com.example.checkout.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

/**
 * Payment callback forwarded by the client after the provider widget completes.
 * Accepts the provider's native field names as aliases.
 */
public record VerifyPaymentRequest(
        @NotBlank(message = "orderId is required")
        String orderId,

        @NotBlank(message = "providerOrderId is required")
        @JsonAlias("razorpay_order_id")
        String providerOrderId,

        @NotBlank(message = "providerPaymentId is required")
        @JsonAlias("razorpay_payment_id")
        String providerPaymentId,

        @NotBlank(message = "signature is required")
        @JsonAlias("razorpay_signature")
        String signature
) {
}
