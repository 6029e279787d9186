package com.example.checkout.infrastructure.adapter.out.payment;

import com.example.checkout.application.port.out.PaymentSignaturePort;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies payment callback signatures: hex HMAC-SHA256 over
 * {@code providerOrderId + "|" + providerPaymentId} keyed with the provider secret.
 */
@Component
public class HmacSignatureVerifier implements PaymentSignaturePort {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public HmacSignatureVerifier(@Value("${services.payment-provider.key-secret}") String keySecret) {
        if (keySecret == null || keySecret.isBlank()) {
            throw new IllegalStateException("services.payment-provider.key-secret must be configured");
        }
        this.key = new SecretKeySpec(keySecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    @Override
    public boolean isValid(String providerOrderId, String providerPaymentId, String signature) {
        if (signature == null) {
            return false;
        }
        byte[] expected = sign(providerOrderId + "|" + providerPaymentId)
                .getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        // Constant-time comparison
        return MessageDigest.isEqual(expected, actual);
    }

    /**
     * Computes the hex signature for a payload.
     *
     * @param payload the signed text
     * @return lower-case hex HMAC
     */
    String sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }
}
