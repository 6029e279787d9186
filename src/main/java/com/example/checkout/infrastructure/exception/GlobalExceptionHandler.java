package com.example.checkout.infrastructure.exception;

import com.example.checkout.domain.exception.AccessDeniedException;
import com.example.checkout.domain.exception.ConfirmationDeferredException;
import com.example.checkout.domain.exception.InsufficientStockException;
import com.example.checkout.domain.exception.InvalidTransitionException;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.exception.ProductNotFoundException;
import com.example.checkout.domain.exception.ProviderUnavailableException;
import com.example.checkout.domain.exception.SignatureMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Global exception handler for REST API.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientStock(InsufficientStockException ex) {
        log.warn("Insufficient stock: {}", ex.getMessage());
        List<Map<String, Object>> shortages = ex.getShortages().stream()
                .map(shortage -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("productId", shortage.productId().getValue());
                    entry.put("productName", shortage.productName());
                    entry.put("requested", shortage.requestedQuantity());
                    entry.put("available", shortage.availableQuantity());
                    return entry;
                })
                .toList();
        Map<String, Object> body = body("INSUFFICIENT_STOCK", ex.getMessage());
        body.put("shortages", shortages);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(SignatureMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleSignatureMismatch(SignatureMismatchException ex) {
        log.warn("Rejected payment callback: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("SIGNATURE_MISMATCH", ex.getMessage()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        Map<String, Object> body = body("INVALID_TRANSITION", ex.getMessage());
        body.put("currentStatus", ex.getFrom().wireName());
        body.put("requestedStatus", ex.getTo().wireName());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleOrderNotFound(OrderNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body("ORDER_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(ProductNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleProductNotFound(ProductNotFoundException ex) {
        log.warn("Checkout referenced unknown product: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body("PRODUCT_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(body("ACCESS_DENIED", ex.getMessage()));
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.error("Payment provider unavailable for order {}: {}", ex.getOrderId(), ex.getMessage());
        Map<String, Object> body = body("PROVIDER_UNAVAILABLE", ex.getMessage());
        body.put("orderId", ex.getOrderId().getValue());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(ConfirmationDeferredException.class)
    public ResponseEntity<Map<String, Object>> handleConfirmationDeferred(ConfirmationDeferredException ex) {
        log.error("Confirmation deferred for order {}: {}", ex.getOrderId(), ex.getMessage());
        Map<String, Object> body = body("CONFIRMATION_DEFERRED", ex.getMessage());
        body.put("orderId", ex.getOrderId().getValue());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(body);
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.error("Service unavailable: {} - {}", ex.getServiceName(), ex.getMessage());
        Map<String, Object> body = body("SERVICE_UNAVAILABLE", ex.getMessage());
        body.put("service", ex.getServiceName());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(NonRetryableServiceException.class)
    public ResponseEntity<Map<String, Object>> handleNonRetryableService(NonRetryableServiceException ex) {
        log.error("Non-retryable service error: {} - {} - {}",
                ex.getServiceName(), ex.getStatusCode(), ex.getMessage());
        Map<String, Object> body = body("SERVICE_ERROR", ex.getMessage());
        body.put("service", ex.getServiceName());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(RequestInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleRequestInProgress(RequestInProgressException ex) {
        Map<String, Object> body = body("REQUEST_IN_PROGRESS", ex.getMessage());
        body.put("idempotencyKey", ex.getIdempotencyKey());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        List<String> errors = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        log.warn("Validation failed: {}", errors);
        Map<String, Object> body = body("VALIDATION_ERROR", "Request validation failed");
        body.put("errors", errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(ServerWebInputException ex) {
        log.warn("Bad request input: {}", ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("VALIDATION_ERROR", ex.getReason() != null ? ex.getReason() : "Invalid request"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("VALIDATION_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String error = resolved != null ? resolved.name() : "HTTP_" + status.value();
        return ResponseEntity.status(status)
                .body(body(error, ex.getReason() != null ? ex.getReason() : error));
    }

    /**
     * Async checkout failures may arrive wrapped; unwrap them to the matching handler.
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ProviderUnavailableException e) {
            return handleProviderUnavailable(e);
        }
        if (cause instanceof InsufficientStockException e) {
            return handleInsufficientStock(e);
        }
        if (cause instanceof ProductNotFoundException e) {
            return handleProductNotFound(e);
        }
        if (cause instanceof ServiceUnavailableException e) {
            return handleServiceUnavailable(e);
        }
        if (cause instanceof NonRetryableServiceException e) {
            return handleNonRetryableService(e);
        }
        if (cause instanceof IllegalArgumentException e) {
            return handleIllegalArgument(e);
        }
        return handleGenericException(ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message != null ? message : error);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
