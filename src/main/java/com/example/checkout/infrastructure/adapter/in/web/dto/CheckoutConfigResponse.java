package com.example.checkout.infrastructure.adapter.in.web.dto;

/**
 * Public payment configuration for the storefront. Never contains the key secret.
 */
public record CheckoutConfigResponse(String keyId, String currency) {
}
