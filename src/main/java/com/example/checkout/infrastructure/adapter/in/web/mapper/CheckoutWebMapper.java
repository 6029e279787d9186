package com.example.checkout.infrastructure.adapter.in.web.mapper;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.dto.CheckoutCommand.LineRequest;
import com.example.checkout.application.dto.CheckoutResult;
import com.example.checkout.application.dto.VerificationResult;
import com.example.checkout.application.dto.VerifyPaymentCommand;
import com.example.checkout.domain.model.ShippingAddress;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutRequest.ShippingAddressRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.VerifyPaymentRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.VerifyPaymentResponse;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class CheckoutWebMapper {

    public CheckoutCommand toCommand(String userId, CheckoutRequest request) {
        List<LineRequest> items = request.items() == null
                ? List.of()
                : request.items().stream()
                        .map(item -> new LineRequest(item.resolvedProductId(), item.resolvedQuantity()))
                        .toList();

        return new CheckoutCommand(userId, items, toAddress(request.shippingAddress()), request.currency());
    }

    public CheckoutResponse toResponse(CheckoutResult result, String providerKeyId) {
        return new CheckoutResponse(
                result.orderId(),
                result.providerOrderId(),
                result.amount(),
                result.amountInMinorUnits(),
                result.currency(),
                providerKeyId,
                result.status(),
                result.createdAt());
    }

    public VerifyPaymentCommand toCommand(VerifyPaymentRequest request) {
        return new VerifyPaymentCommand(
                request.orderId(),
                request.providerOrderId(),
                request.providerPaymentId(),
                request.signature());
    }

    public VerifyPaymentResponse toResponse(VerificationResult result) {
        return new VerifyPaymentResponse(
                result.orderId(),
                result.status(),
                result.alreadyProcessed(),
                result.message());
    }

    private ShippingAddress toAddress(ShippingAddressRequest address) {
        return new ShippingAddress(
                address.street(),
                address.city(),
                address.state(),
                address.country(),
                address.zipCode(),
                address.phone());
    }
}
