package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.dto.CheckoutResult;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for starting a checkout.
 */
public interface CheckoutUseCase {

    /**
     * Validates stock, creates a pending order and registers it with the payment provider.
     *
     * @param command the checkout command
     * @return future containing the registered order, failing with
     *         {@link com.example.checkout.domain.exception.ProviderUnavailableException} when registration fails
     */
    CompletableFuture<CheckoutResult> checkout(CheckoutCommand command);
}
