package com.example.checkout.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Client report that the provider payment failed or was abandoned.
 */
public record PaymentFailedRequest(
        @NotBlank(message = "orderId is required")
        String orderId,

        @Size(max = 500, message = "Reason is limited to 500 characters")
        String reason
) {
}
