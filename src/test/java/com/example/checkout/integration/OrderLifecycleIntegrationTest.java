package com.example.checkout.integration;

import com.example.checkout.support.WireMockTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for cancellation and operator status changes, including stock restoration.
 */
@DisplayName("Order Lifecycle Integration Tests")
class OrderLifecycleIntegrationTest extends WireMockTestSupport {

    private static final String PROVIDER_ORDER_ID = "order_LC1";

    @BeforeEach
    void setUp() {
        seedProduct("lamp-01", "Desk Lamp", "499.00", 10);
        seedProduct("desk-02", "Standing Desk", "12999.00", 10);
        stubCartClear(USER_ID);
    }

    @Nested
    @DisplayName("Customer cancellation")
    class CustomerCancellation {

        @Test
        @DisplayName("should cancel a pending order without touching stock")
        void should_cancel_pending_without_restore() {
            String orderId = checkout(USER_ID, PROVIDER_ORDER_ID, List.of(line("lamp-01", 2)));

            cancel(USER_ID, orderId)
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("cancelled");

            assertThat(stockOf("lamp-01")).isEqualTo(10);
        }

        @Test
        @DisplayName("should restore every line when a confirmed order is cancelled")
        void should_restore_confirmed_order() {
            String orderId = confirmedOrder(List.of(line("lamp-01", 1), line("desk-02", 3)));
            assertThat(stockOf("lamp-01")).isEqualTo(9);
            assertThat(stockOf("desk-02")).isEqualTo(7);

            cancel(USER_ID, orderId).expectStatus().isOk();

            assertThat(stockOf("lamp-01")).isEqualTo(10);
            assertThat(stockOf("desk-02")).isEqualTo(10);
        }

        @Test
        @DisplayName("should restore stock once even if cancel is repeated")
        void should_not_restore_twice() {
            String orderId = confirmedOrder(List.of(line("lamp-01", 4)));

            cancel(USER_ID, orderId).expectStatus().isOk();
            cancel(USER_ID, orderId)
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("INVALID_TRANSITION")
                    .jsonPath("$.currentStatus").isEqualTo("cancelled");

            assertThat(stockOf("lamp-01")).isEqualTo(10);
        }

        @Test
        @DisplayName("should refuse to cancel another user's order")
        void should_reject_non_owner() {
            String orderId = checkout(USER_ID, PROVIDER_ORDER_ID, List.of(line("lamp-01", 1)));

            cancel(OTHER_USER_ID, orderId)
                    .expectStatus().isForbidden()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("ACCESS_DENIED");
        }

        @Test
        @DisplayName("should return 404 for an unknown order")
        void should_return_not_found() {
            cancel(USER_ID, "7d3c1c1e-52f4-4c43-9d5c-2f0a1f0e9b11")
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("ORDER_NOT_FOUND");
        }
    }

    @Nested
    @DisplayName("Operator status changes")
    class OperatorStatusChanges {

        @Test
        @DisplayName("should walk an order through fulfilment")
        void should_follow_transition_table() {
            String orderId = confirmedOrder(List.of(line("lamp-01", 1)));

            updateStatus(orderId, "processing").expectStatus().isOk();
            updateStatus(orderId, "shipped").expectStatus().isOk();
            updateStatus(orderId, "delivered")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("delivered");

            assertThat(stockOf("lamp-01")).isEqualTo(9);
        }

        @Test
        @DisplayName("should reject skipping from pending to delivered")
        void should_reject_invalid_transition() {
            String orderId = checkout(USER_ID, PROVIDER_ORDER_ID, List.of(line("lamp-01", 1)));

            updateStatus(orderId, "delivered")
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.currentStatus").isEqualTo("pending")
                    .jsonPath("$.requestedStatus").isEqualTo("delivered");
        }

        @Test
        @DisplayName("should restore stock when a shipped order is cancelled")
        void should_restore_shipped_order() {
            String orderId = confirmedOrder(List.of(line("desk-02", 2)));
            updateStatus(orderId, "processing").expectStatus().isOk();
            updateStatus(orderId, "shipped").expectStatus().isOk();

            updateStatus(orderId, "cancelled").expectStatus().isOk();

            assertThat(stockOf("desk-02")).isEqualTo(10);
        }

        @Test
        @DisplayName("should reject an unknown status name")
        void should_reject_unknown_status() {
            String orderId = checkout(USER_ID, PROVIDER_ORDER_ID, List.of(line("lamp-01", 1)));

            updateStatus(orderId, "teleported")
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
        }

        @Test
        @DisplayName("should require the admin role")
        void should_require_admin_role() {
            String orderId = checkout(USER_ID, PROVIDER_ORDER_ID, List.of(line("lamp-01", 1)));

            webTestClient.put()
                    .uri("/api/orders/{id}/status", orderId)
                    .header("X-User-Id", USER_ID)
                    .bodyValue(Map.of("status", "confirmed"))
                    .exchange()
                    .expectStatus().isForbidden();
        }
    }

    @Nested
    @DisplayName("Order queries")
    class OrderQueries {

        @Test
        @DisplayName("should list only the caller's orders")
        void should_list_own_orders() {
            checkout(USER_ID, PROVIDER_ORDER_ID, List.of(line("lamp-01", 1)));
            checkout(OTHER_USER_ID, "order_LC2", List.of(line("desk-02", 1)));

            webTestClient.get()
                    .uri("/api/orders")
                    .header("X-User-Id", USER_ID)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(1)
                    .jsonPath("$[0].userId").isEqualTo(USER_ID);
        }

        @Test
        @DisplayName("should hide another user's order")
        void should_hide_foreign_order() {
            String orderId = checkout(USER_ID, PROVIDER_ORDER_ID, List.of(line("lamp-01", 1)));

            webTestClient.get()
                    .uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", OTHER_USER_ID)
                    .exchange()
                    .expectStatus().isForbidden();
        }
    }

    private String confirmedOrder(List<Map<String, Object>> lines) {
        String orderId = checkout(USER_ID, PROVIDER_ORDER_ID, lines);
        verify(orderId, PROVIDER_ORDER_ID, "pay_" + orderId.substring(0, 8))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("confirmed");
        return orderId;
    }
}
