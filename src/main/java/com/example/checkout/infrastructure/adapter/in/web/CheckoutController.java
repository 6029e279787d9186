package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.application.dto.CheckoutCommand;
import com.example.checkout.application.dto.CheckoutResult;
import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.port.in.CheckoutUseCase;
import com.example.checkout.application.port.in.VerifyPaymentUseCase;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutConfigResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.PaymentFailedRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.VerifyPaymentRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.VerifyPaymentResponse;
import com.example.checkout.infrastructure.adapter.in.web.mapper.CheckoutWebMapper;
import com.example.checkout.infrastructure.exception.RequestInProgressException;
import com.example.checkout.infrastructure.service.IdempotencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for checkout and payment callbacks.
 * Supports idempotent checkout via the X-Idempotency-Key header.
 */
@RestController
@RequestMapping("/api/checkout")
@Tag(name = "Checkout", description = "Checkout and payment verification")
public class CheckoutController {

    private static final Logger log = LoggerFactory.getLogger(CheckoutController.class);
    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 64;

    private final CheckoutUseCase checkoutUseCase;
    private final VerifyPaymentUseCase verifyPaymentUseCase;
    private final CheckoutWebMapper mapper;
    private final IdempotencyService idempotencyService;
    private final String providerKeyId;
    private final String storeCurrency;

    public CheckoutController(
            CheckoutUseCase checkoutUseCase,
            VerifyPaymentUseCase verifyPaymentUseCase,
            CheckoutWebMapper mapper,
            IdempotencyService idempotencyService,
            @Value("${services.payment-provider.key-id:}") String providerKeyId,
            @Value("${checkout.currency:INR}") String storeCurrency) {
        this.checkoutUseCase = checkoutUseCase;
        this.verifyPaymentUseCase = verifyPaymentUseCase;
        this.mapper = mapper;
        this.idempotencyService = idempotencyService;
        this.providerKeyId = providerKeyId;
        this.storeCurrency = storeCurrency;
    }

    @Operation(
            summary = "Start checkout",
            description = """
                    Creates a **pending** order and registers it with the payment provider:
                    1. Availability pre-check for every line (all shortages reported at once)
                    2. Pending order with server-side prices
                    3. Provider order registration under timeout, circuit breaker and retry

                    No stock is taken until the payment is verified. Without `items` the caller's cart is used.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Pending order registered with the payment provider",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CheckoutResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "orderId": "550e8400-e29b-41d4-a716-446655440000",
                                      "providerOrderId": "order_NB2tY1rFzP1a9c",
                                      "amount": 1499.00,
                                      "amountInMinorUnits": 149900,
                                      "currency": "INR",
                                      "providerKeyId": "rzp_test_key",
                                      "status": "pending",
                                      "createdAt": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "200", description = "Idempotent replay of an earlier checkout"),
            @ApiResponse(responseCode = "400", description = "Invalid request, unknown currency or empty cart"),
            @ApiResponse(
                    responseCode = "409",
                    description = "Insufficient stock, or the same idempotency key is in flight",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "INSUFFICIENT_STOCK",
                                      "message": "Insufficient stock: Desk Lamp (requested 3, available 1)",
                                      "shortages": [
                                        {"productId": "lamp-01", "productName": "Desk Lamp", "requested": 3, "available": 1}
                                      ],
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "503", description = "Payment provider unavailable, the order stays pending")
    })
    @PostMapping
    public Mono<ResponseEntity<CheckoutResponse>> checkout(
            @RequestHeader(RequestIdentity.USER_ID_HEADER) String userId,
            @Parameter(description = "Idempotency key, a retry with the same key returns the original order")
            @RequestHeader(value = "X-Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody CheckoutRequest request) {

        // Catalog and idempotency lookups block on JDBC
        return Mono.fromCallable(() -> startCheckout(userId, idempotencyKey, request))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::fromFuture);
    }

    private CompletableFuture<ResponseEntity<CheckoutResponse>> startCheckout(
            String userId, String idempotencyKey, CheckoutRequest request) {

        CheckoutCommand command = mapper.toCommand(userId, request);

        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return checkoutUseCase.checkout(command)
                    .thenApply(result -> ResponseEntity.status(HttpStatus.CREATED)
                            .body(mapper.toResponse(result, providerKeyId)));
        }

        if (idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "X-Idempotency-Key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }

        Optional<CheckoutResult> existingResult = idempotencyService.getExistingResult(userId, idempotencyKey);
        if (existingResult.isPresent()) {
            log.info("Returning cached checkout for idempotency key: {}", idempotencyKey);
            return CompletableFuture.completedFuture(
                    ResponseEntity.ok(mapper.toResponse(existingResult.get(), providerKeyId)));
        }

        if (!idempotencyService.markInProgress(userId, idempotencyKey)) {
            log.warn("Checkout already in progress for idempotency key: {}", idempotencyKey);
            throw new RequestInProgressException(idempotencyKey);
        }

        return checkoutUseCase.checkout(command)
                .whenComplete((result, throwable) -> {
                    if (throwable != null) {
                        idempotencyService.markFailed(userId, idempotencyKey);
                    } else {
                        idempotencyService.saveResult(userId, idempotencyKey, result);
                    }
                })
                .thenApply(result -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(mapper.toResponse(result, providerKeyId)));
    }

    @Operation(
            summary = "Verify payment",
            description = """
                    Checks the provider signature, confirms the order and commits its stock atomically.
                    Repeating the call with the same payment id returns the original outcome.
                    If stock ran out after checkout the order is cancelled and a refund is arranged by an operator.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment processed"),
            @ApiResponse(responseCode = "400", description = "Signature mismatch or invalid request"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "503", description = "Payment recorded but not confirmed yet, resend the callback")
    })
    @PostMapping("/verify")
    public Mono<ResponseEntity<VerifyPaymentResponse>> verify(@Valid @RequestBody VerifyPaymentRequest request) {
        return Mono.fromCallable(() -> verifyPaymentUseCase.verify(mapper.toCommand(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(mapper.toResponse(result)));
    }

    @Operation(summary = "Report payment failure", description = "Cancels the caller's pending order")
    @PostMapping("/payment-failed")
    public Mono<ResponseEntity<OrderView>> paymentFailed(
            @RequestHeader(RequestIdentity.USER_ID_HEADER) String userId,
            @Valid @RequestBody PaymentFailedRequest request) {
        return Mono.fromCallable(() ->
                        verifyPaymentUseCase.recordPaymentFailure(userId, request.orderId(), request.reason()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Payment widget configuration")
    @GetMapping("/config")
    public ResponseEntity<CheckoutConfigResponse> config() {
        return ResponseEntity.ok(new CheckoutConfigResponse(providerKeyId, storeCurrency));
    }
}
