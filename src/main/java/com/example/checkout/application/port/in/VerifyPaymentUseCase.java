package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.dto.VerificationResult;
import com.example.checkout.application.dto.VerifyPaymentCommand;

/**
 * Inbound port for payment provider callbacks.
 */
public interface VerifyPaymentUseCase {

    /**
     * Verifies a payment callback and confirms the order. Safe to call repeatedly
     * with the same provider payment id.
     *
     * @param command the callback data
     * @return the payer-facing outcome
     */
    VerificationResult verify(VerifyPaymentCommand command);

    /**
     * Records a payment failure reported by the client and cancels the pending order.
     *
     * @param userId  the calling user
     * @param orderId the order
     * @param reason  provider error description, may be null
     * @return the cancelled order
     */
    OrderView recordPaymentFailure(String userId, String orderId, String reason);
}
