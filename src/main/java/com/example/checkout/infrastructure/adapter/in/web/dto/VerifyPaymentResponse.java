package com.example.checkout.infrastructure.adapter.in.web.dto;

public record VerifyPaymentResponse(
        String orderId,
        String status,
        boolean alreadyProcessed,
        String message
) {
}
