package com.example.checkout.unit.application;

import com.example.checkout.application.dto.VerificationResult;
import com.example.checkout.application.dto.VerifyPaymentCommand;
import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.application.port.out.InventoryPort.StockLevel;
import com.example.checkout.application.port.out.NotificationPort;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.application.port.out.PaymentSignaturePort;
import com.example.checkout.application.service.OrderTransitionService;
import com.example.checkout.application.service.OrderTransitionService.ConfirmationOutcome;
import com.example.checkout.application.service.PaymentVerificationService;
import com.example.checkout.domain.exception.ConfirmationDeferredException;
import com.example.checkout.domain.exception.InsufficientStockException;
import com.example.checkout.domain.exception.SignatureMismatchException;
import com.example.checkout.domain.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentVerificationService Unit Tests")
class PaymentVerificationServiceTest {

    private static final String PROVIDER_ORDER_ID = "order_P1";
    private static final String PAYMENT_ID = "pay_1";
    private static final String SIGNATURE = "a1b2c3";

    @Mock
    private OrderStorePort orderStore;

    @Mock
    private PaymentSignaturePort signaturePort;

    @Mock
    private OrderTransitionService transitions;

    @Mock
    private CartPort cartPort;

    @Mock
    private NotificationPort notificationPort;

    @InjectMocks
    private PaymentVerificationService service;

    private OrderId orderId;
    private Order pendingOrder;

    @BeforeEach
    void setUp() {
        orderId = OrderId.generate();
        pendingOrder = order(OrderStatus.PENDING, new PaymentReference(PROVIDER_ORDER_ID, null, null));
        lenient().when(orderStore.findById(orderId)).thenReturn(Optional.of(pendingOrder));
    }

    @Nested
    @DisplayName("Signature checks")
    class SignatureChecks {

        @Test
        @DisplayName("should cancel pending order and reject mismatched signature")
        void should_cancel_order_on_signature_mismatch() {
            // Given
            when(signaturePort.isValid(PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE)).thenReturn(false);
            when(orderStore.compareAndSetStatus(orderId, OrderStatus.PENDING, OrderStatus.CANCELLED,
                    "Signature verification failed")).thenReturn(true);

            // When & Then
            assertThatThrownBy(() -> service.verify(command()))
                    .isInstanceOf(SignatureMismatchException.class);

            verify(notificationPort).emit(eq(NotificationType.PAYMENT_FAILED), anyString(), eq(orderId), anyMap());
            verifyNoInteractions(transitions, cartPort);
        }

        @Test
        @DisplayName("should reject callback whose provider order belongs to another order")
        void should_reject_foreign_provider_order() {
            VerifyPaymentCommand foreign = new VerifyPaymentCommand(
                    orderId.getValue(), "order_OTHER", PAYMENT_ID, SIGNATURE);

            assertThatThrownBy(() -> service.verify(foreign))
                    .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(signaturePort, transitions);
            verify(orderStore, never()).compareAndSetStatus(any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Confirmation")
    class Confirmation {

        @BeforeEach
        void validSignature() {
            when(signaturePort.isValid(PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE)).thenReturn(true);
        }

        @Test
        @DisplayName("should confirm order, clear cart and notify")
        void should_confirm_and_run_hooks() {
            // Given
            StockLevel level = new StockLevel(ProductId.of("lamp-01"), 8, 5, true);
            when(transitions.confirmAndCommit(pendingOrder, PAYMENT_ID, SIGNATURE))
                    .thenReturn(new ConfirmationOutcome(true, List.of(level)));
            when(cartPort.clearCart("user-1")).thenReturn(CompletableFuture.completedFuture(null));

            // When
            VerificationResult result = service.verify(command());

            // Then
            assertThat(result.status()).isEqualTo("confirmed");
            assertThat(result.alreadyProcessed()).isFalse();
            verify(cartPort).clearCart("user-1");
            verify(notificationPort).emit(eq(NotificationType.ORDER_CONFIRMED), anyString(), eq(orderId), anyMap());
            verify(notificationPort, never()).emit(eq(NotificationType.LOW_STOCK), anyString(), any(), anyMap());
        }

        @Test
        @DisplayName("should emit low stock alert when remaining stock falls to the threshold")
        void should_emit_low_stock_alert() {
            StockLevel level = new StockLevel(ProductId.of("lamp-01"), 2, 5, true);
            when(transitions.confirmAndCommit(pendingOrder, PAYMENT_ID, SIGNATURE))
                    .thenReturn(new ConfirmationOutcome(true, List.of(level)));
            when(cartPort.clearCart("user-1")).thenReturn(CompletableFuture.completedFuture(null));

            service.verify(command());

            verify(notificationPort).emit(eq(NotificationType.LOW_STOCK), contains("lamp-01"), eq(orderId), anyMap());
        }

        @Test
        @DisplayName("should keep confirmation when cart clear fails")
        void should_ignore_cart_clear_failure() {
            when(transitions.confirmAndCommit(pendingOrder, PAYMENT_ID, SIGNATURE))
                    .thenReturn(new ConfirmationOutcome(true, List.of()));
            when(cartPort.clearCart("user-1"))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("cart down")));

            VerificationResult result = service.verify(command());

            assertThat(result.status()).isEqualTo("confirmed");
            verify(notificationPort).emit(eq(NotificationType.ORDER_CONFIRMED), anyString(), eq(orderId), anyMap());
        }

        @Test
        @DisplayName("should cancel and flag manual refund when stock ran out")
        void should_flag_manual_refund_when_stock_short() {
            // Given
            when(transitions.confirmAndCommit(pendingOrder, PAYMENT_ID, SIGNATURE))
                    .thenThrow(new InsufficientStockException(ProductId.of("lamp-01"), 2, 1));
            when(orderStore.cancelUnfulfillable(orderId, PAYMENT_ID, SIGNATURE, "stock unavailable at confirmation"))
                    .thenReturn(true);

            // When
            VerificationResult result = service.verify(command());

            // Then
            assertThat(result.status()).isEqualTo("cancelled");
            verify(notificationPort).emit(eq(NotificationType.REQUIRES_MANUAL_REFUND), anyString(), eq(orderId),
                    argThat(metadata -> metadata.get("shortProducts").equals(List.of("lamp-01"))));
            verifyNoInteractions(cartPort);
        }

        @Test
        @DisplayName("should report already processed when a concurrent callback won the claim")
        void should_resolve_lost_claim_as_already_processed() {
            Order confirmed = order(OrderStatus.CONFIRMED, new PaymentReference(PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE));
            when(transitions.confirmAndCommit(pendingOrder, PAYMENT_ID, SIGNATURE))
                    .thenReturn(new ConfirmationOutcome(false, List.of()));
            when(orderStore.findById(orderId))
                    .thenReturn(Optional.of(pendingOrder))
                    .thenReturn(Optional.of(confirmed));

            VerificationResult result = service.verify(command());

            assertThat(result.alreadyProcessed()).isTrue();
            assertThat(result.status()).isEqualTo("confirmed");
            verifyNoInteractions(cartPort);
        }
    }

    @Nested
    @DisplayName("Transient store failures")
    class TransientStoreFailures {

        @BeforeEach
        void validSignature() {
            when(signaturePort.isValid(PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE)).thenReturn(true);
            when(transitions.confirmAndCommit(pendingOrder, PAYMENT_ID, SIGNATURE))
                    .thenThrow(new CannotAcquireLockException("Deadlock detected"));
        }

        @Test
        @DisplayName("should record the payment on the pending order and ask for a resend")
        void should_defer_confirmation_and_keep_payment() {
            when(orderStore.recordPaymentAttempt(orderId, PAYMENT_ID, SIGNATURE)).thenReturn(true);

            assertThatThrownBy(() -> service.verify(command()))
                    .isInstanceOf(ConfirmationDeferredException.class)
                    .hasCauseInstanceOf(CannotAcquireLockException.class);

            verify(orderStore).recordPaymentAttempt(orderId, PAYMENT_ID, SIGNATURE);
            verifyNoInteractions(cartPort, notificationPort);
        }

        @Test
        @DisplayName("should fall back to the stored state when the order moved on meanwhile")
        void should_resolve_against_stored_state_when_not_recorded() {
            Order confirmed = order(OrderStatus.CONFIRMED, new PaymentReference(PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE));
            when(orderStore.recordPaymentAttempt(orderId, PAYMENT_ID, SIGNATURE)).thenReturn(false);
            when(orderStore.findById(orderId))
                    .thenReturn(Optional.of(pendingOrder))
                    .thenReturn(Optional.of(confirmed));

            VerificationResult result = service.verify(command());

            assertThat(result.alreadyProcessed()).isTrue();
            assertThat(result.status()).isEqualTo("confirmed");
        }

        @Test
        @DisplayName("should still ask for a resend when the payment cannot be recorded either")
        void should_defer_when_recording_fails() {
            when(orderStore.recordPaymentAttempt(orderId, PAYMENT_ID, SIGNATURE))
                    .thenThrow(new CannotAcquireLockException("still locked"));

            assertThatThrownBy(() -> service.verify(command()))
                    .isInstanceOf(ConfirmationDeferredException.class)
                    .satisfies(thrown -> assertThat(thrown.getCause().getSuppressed()).hasSize(1));
        }
    }

    @Nested
    @DisplayName("Idempotency and late payments")
    class IdempotencyAndLatePayments {

        @BeforeEach
        void validSignature() {
            when(signaturePort.isValid(PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE)).thenReturn(true);
        }

        @Test
        @DisplayName("should return same success without side effects for a repeated payment")
        void should_return_already_processed_for_same_payment() {
            Order confirmed = order(OrderStatus.CONFIRMED, new PaymentReference(PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE));
            when(orderStore.findById(orderId)).thenReturn(Optional.of(confirmed));

            VerificationResult result = service.verify(command());

            assertThat(result.alreadyProcessed()).isTrue();
            verifyNoInteractions(transitions, cartPort, notificationPort);
        }

        @Test
        @DisplayName("should confirm a pending order that only carries an earlier payment attempt")
        void should_confirm_pending_order_with_recorded_attempt() {
            Order attempted = order(OrderStatus.PENDING, new PaymentReference(PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE));
            when(orderStore.findById(orderId)).thenReturn(Optional.of(attempted));
            when(transitions.confirmAndCommit(attempted, PAYMENT_ID, SIGNATURE))
                    .thenReturn(new ConfirmationOutcome(true, List.of()));
            when(cartPort.clearCart("user-1")).thenReturn(CompletableFuture.completedFuture(null));

            VerificationResult result = service.verify(command());

            assertThat(result.alreadyProcessed()).isFalse();
            assertThat(result.status()).isEqualTo("confirmed");
        }

        @Test
        @DisplayName("should flag manual refund for a valid payment on a cancelled order")
        void should_flag_refund_for_payment_on_cancelled_order() {
            Order cancelled = order(OrderStatus.CANCELLED, new PaymentReference(PROVIDER_ORDER_ID, null, null));
            when(orderStore.findById(orderId)).thenReturn(Optional.of(cancelled));

            VerificationResult result = service.verify(command());

            assertThat(result.status()).isEqualTo("cancelled");
            verify(orderStore).flagManualRefund(eq(orderId), eq(PAYMENT_ID), contains("cancelled"));
            verify(notificationPort).emit(eq(NotificationType.REQUIRES_MANUAL_REFUND), anyString(), eq(orderId), anyMap());
            verifyNoInteractions(transitions);
        }
    }

    private VerifyPaymentCommand command() {
        return new VerifyPaymentCommand(orderId.getValue(), PROVIDER_ORDER_ID, PAYMENT_ID, SIGNATURE);
    }

    private Order order(OrderStatus status, PaymentReference reference) {
        ProductSnapshot lamp = new ProductSnapshot(ProductId.of("lamp-01"), "Desk Lamp",
                Money.of(new BigDecimal("499.00"), "INR"), "home");
        return Order.reconstitute(orderId, "user-1", List.of(LineItem.of(lamp, 2)), "INR",
                new ShippingAddress("12 MG Road", "Bengaluru", "KA", "IN", "560001", null),
                Instant.now(), Instant.now(), status, reference, null, false);
    }
}
