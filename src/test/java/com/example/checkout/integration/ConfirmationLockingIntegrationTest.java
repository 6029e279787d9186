package com.example.checkout.integration;

import com.example.checkout.application.port.in.OrderLifecycleUseCase;
import com.example.checkout.domain.model.ProductId;
import com.example.checkout.infrastructure.persistence.InventoryLedgerService;
import com.example.checkout.infrastructure.persistence.entity.NotificationTypeEnum;
import com.example.checkout.infrastructure.persistence.entity.OrderEntity;
import com.example.checkout.infrastructure.persistence.entity.OrderStatusEnum;
import com.example.checkout.support.WireMockTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.CannotAcquireLockException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Integration tests for confirmations that contend for the same product rows:
 * lock ordering across orders, retry of the confirmation unit, and payments whose
 * confirmation could not complete.
 */
@DisplayName("Confirmation Locking Integration Tests")
class ConfirmationLockingIntegrationTest extends WireMockTestSupport {

    @SpyBean
    private InventoryLedgerService inventoryLedger;

    @Autowired
    private OrderLifecycleUseCase lifecycle;

    @BeforeEach
    void setUp() {
        seedProduct("lamp-01", "Desk Lamp", "499.00", 10);
        seedProduct("desk-02", "Standing Desk", "12999.00", 10);
        stubCartClear(USER_ID);
    }

    @Nested
    @DisplayName("Shared products")
    class SharedProducts {

        @Test
        @DisplayName("should confirm two orders listing the same products in opposite order")
        void should_confirm_orders_with_reversed_lines() throws Exception {
            // Given
            String first = checkout(USER_ID, "order_LK1", List.of(line("lamp-01", 1), line("desk-02", 1)));
            String second = checkout(USER_ID, "order_LK2", List.of(line("desk-02", 2), line("lamp-01", 2)));

            // Each commit holds its row lock a little longer so both units overlap
            doAnswer(invocation -> {
                Object level = invocation.callRealMethod();
                Thread.sleep(200);
                return level;
            }).when(inventoryLedger).commit(any(ProductId.class), anyInt());

            // When
            CountDownLatch start = new CountDownLatch(1);
            CompletableFuture<Integer> firstStatus = CompletableFuture.supplyAsync(() ->
                    verifyAfter(start, first, "order_LK1", "pay_A"));
            CompletableFuture<Integer> secondStatus = CompletableFuture.supplyAsync(() ->
                    verifyAfter(start, second, "order_LK2", "pay_B"));
            start.countDown();

            // Then
            assertThat(firstStatus.get(20, TimeUnit.SECONDS)).isEqualTo(200);
            assertThat(secondStatus.get(20, TimeUnit.SECONDS)).isEqualTo(200);
            assertThat(statusOf(first)).isEqualTo(OrderStatusEnum.CONFIRMED);
            assertThat(statusOf(second)).isEqualTo(OrderStatusEnum.CONFIRMED);
            assertThat(stockOf("lamp-01")).isEqualTo(7);
            assertThat(stockOf("desk-02")).isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("Transient lock failures")
    class TransientLockFailures {

        @Test
        @DisplayName("should retry the whole confirmation after a lock conflict")
        void should_retry_confirmation_unit() {
            String orderId = checkout(USER_ID, "order_LK3", List.of(line("lamp-01", 1), line("desk-02", 1)));
            // First attempt fails on desk-02 after nothing was committed, the retry goes through
            doThrow(new CannotAcquireLockException("Deadlock detected"))
                    .doCallRealMethod()
                    .when(inventoryLedger).commit(any(ProductId.class), anyInt());

            verify(orderId, "order_LK3", "pay_1")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("confirmed");

            assertThat(stockOf("lamp-01")).isEqualTo(9);
            assertThat(stockOf("desk-02")).isEqualTo(9);
            assertThat(statusOf(orderId)).isEqualTo(OrderStatusEnum.CONFIRMED);
        }

        @Test
        @DisplayName("should keep a paid order out of expiry when confirmation keeps failing")
        void should_keep_payment_when_confirmation_gives_up() {
            // Given
            String orderId = checkout(USER_ID, "order_LK4", List.of(line("lamp-01", 2)));
            doThrow(new CannotAcquireLockException("Deadlock detected"))
                    .when(inventoryLedger).commit(any(ProductId.class), anyInt());

            // When
            verify(orderId, "order_LK4", "pay_1")
                    .expectStatus().isEqualTo(503)
                    .expectHeader().exists("Retry-After")
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("CONFIRMATION_DEFERRED")
                    .jsonPath("$.orderId").isEqualTo(orderId);

            // Then: the payment sticks to the pending order
            OrderEntity pending = orderRepository.findById(orderId).orElseThrow();
            assertThat(pending.getStatus()).isEqualTo(OrderStatusEnum.PENDING);
            assertThat(pending.getProviderPaymentId()).isEqualTo("pay_1");
            assertThat(stockOf("lamp-01")).isEqualTo(10);

            // And expiry flags it for refund instead of cancelling it
            assertThat(lifecycle.expireStalePending(Duration.ZERO)).isZero();
            OrderEntity held = orderRepository.findById(orderId).orElseThrow();
            assertThat(held.getStatus()).isEqualTo(OrderStatusEnum.PENDING);
            assertThat(held.isRequiresManualRefund()).isTrue();
            assertThat(notificationRepository.countByTypeAndOrderId(NotificationTypeEnum.REQUIRES_MANUAL_REFUND, orderId))
                    .isEqualTo(1);
            assertThat(notificationRepository.countByTypeAndOrderId(NotificationTypeEnum.ORDER_EXPIRED, orderId))
                    .isZero();
        }

        @Test
        @DisplayName("should confirm on a resent callback once the store recovers")
        void should_confirm_on_resend() {
            String orderId = checkout(USER_ID, "order_LK5", List.of(line("lamp-01", 2)));
            doThrow(new CannotAcquireLockException("Deadlock detected"))
                    .when(inventoryLedger).commit(any(ProductId.class), anyInt());
            verify(orderId, "order_LK5", "pay_1").expectStatus().isEqualTo(503);

            reset(inventoryLedger);

            verify(orderId, "order_LK5", "pay_1")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("confirmed")
                    .jsonPath("$.alreadyProcessed").isEqualTo(false);
            assertThat(stockOf("lamp-01")).isEqualTo(8);
        }
    }

    private int verifyAfter(CountDownLatch start, String orderId, String providerOrderId, String paymentId) {
        try {
            start.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return verify(orderId, providerOrderId, paymentId)
                .returnResult(String.class)
                .getStatus()
                .value();
    }

    private OrderStatusEnum statusOf(String orderId) {
        return orderRepository.findById(orderId).orElseThrow().getStatus();
    }
}
