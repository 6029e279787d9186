package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.Money;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the external payment provider.
 */
public interface PaymentProviderPort {

    /**
     * Registers a payable order with the provider.
     *
     * @param amount  the amount to collect
     * @param receipt our reference for the provider order ("order_&lt;orderId&gt;")
     * @return future containing the provider order
     */
    CompletableFuture<ProviderOrder> createProviderOrder(Money amount, String receipt);

    /**
     * Order created on the provider side.
     */
    record ProviderOrder(
            String providerOrderId,
            long amountInMinorUnits,
            String currency,
            String status
    ) {
    }
}
