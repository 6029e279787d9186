package com.example.checkout.infrastructure.adapter.out.payment.mapper;

import com.example.checkout.application.port.out.PaymentProviderPort.ProviderOrder;
import com.example.checkout.domain.model.Money;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ProviderOrderRequest;
import com.example.checkout.infrastructure.adapter.out.payment.dto.ProviderOrderResponse;
import org.springframework.stereotype.Component;

/**
 * Mapper between domain objects and payment provider DTOs.
 */
@Component
public class PaymentProviderMapper {

    public ProviderOrderRequest toRequest(Money amount, String receipt) {
        return ProviderOrderRequest.autoCapture(
                amount.toMinorUnits(),
                amount.getCurrency(),
                receipt
        );
    }

    public ProviderOrder toProviderOrder(ProviderOrderResponse response) {
        if (response.id() == null || response.id().isBlank()) {
            throw new IllegalStateException("Payment provider returned an order without id");
        }
        return new ProviderOrder(
                response.id(),
                response.amount(),
                response.currency(),
                response.status()
        );
    }
}
