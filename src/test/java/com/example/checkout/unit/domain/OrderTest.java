package com.example.checkout.unit.domain;

import com.example.checkout.domain.exception.InvalidTransitionException;
import com.example.checkout.domain.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Order aggregate and related domain objects.
 */
@DisplayName("Order Domain Tests")
class OrderTest {

    private static final ShippingAddress ADDRESS =
            new ShippingAddress("12 MG Road", "Bengaluru", "KA", "IN", "560001", null);

    @Nested
    @DisplayName("Order Creation")
    class OrderCreation {

        @Test
        @DisplayName("should_create_pending_order_with_valid_items")
        void should_create_pending_order_with_valid_items() {
            // Given
            List<LineItem> items = List.of(line("lamp-01", "1500.00", 2), line("desk-02", "2000.00", 1));

            // When
            Order order = Order.create("user-1", items, ADDRESS, "INR");

            // Then
            assertThat(order.getOrderId()).isNotNull();
            assertThat(order.getItems()).hasSize(2);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getPaymentReference().isRegistered()).isFalse();
            assertThat(order.isRequiresManualRefund()).isFalse();
            assertThat(order.getCreatedAt()).isNotNull();
        }

        @Test
        @DisplayName("should_calculate_total_as_sum_of_line_totals")
        void should_calculate_total_as_sum_of_line_totals() {
            // Given: 2 x 1500 + 3 x 500
            List<LineItem> items = List.of(line("lamp-01", "1500.00", 2), line("desk-02", "500.00", 3));

            // When
            Order order = Order.create("user-1", items, ADDRESS, "INR");

            // Then
            assertThat(order.getTotalAmount()).isEqualTo(Money.of(new BigDecimal("4500.00"), "INR"));
            assertThat(order.getTotalAmount().toMinorUnits()).isEqualTo(450000L);
        }

        @Test
        @DisplayName("should_reject_empty_items_list")
        void should_reject_empty_items_list() {
            assertThatThrownBy(() -> Order.create("user-1", Collections.emptyList(), ADDRESS, "INR"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("at least one item");
        }

        @Test
        @DisplayName("should_reject_line_priced_in_other_currency")
        void should_reject_line_priced_in_other_currency() {
            ProductSnapshot usd = new ProductSnapshot(ProductId.of("lamp-01"), "Lamp",
                    Money.of(new BigDecimal("10.00"), "USD"), "home");

            assertThatThrownBy(() -> Order.create("user-1", List.of(LineItem.of(usd, 1)), ADDRESS, "INR"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("USD");
        }

        @Test
        @DisplayName("should_reject_zero_quantity_line")
        void should_reject_zero_quantity_line() {
            assertThatThrownBy(() -> line("lamp-01", "10.00", 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Order State Transitions")
    class OrderStateTransitions {

        @Test
        @DisplayName("should_walk_the_happy_path_to_delivered")
        void should_walk_the_happy_path_to_delivered() {
            // Given
            Order order = createValidOrder();

            // When & Then
            assertThat(order.transitionTo(OrderStatus.CONFIRMED)).isEqualTo(OrderStatus.PENDING);
            assertThat(order.transitionTo(OrderStatus.PROCESSING)).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.transitionTo(OrderStatus.SHIPPED)).isEqualTo(OrderStatus.PROCESSING);
            assertThat(order.transitionTo(OrderStatus.DELIVERED)).isEqualTo(OrderStatus.SHIPPED);
            assertThat(order.getStatus().isTerminal()).isTrue();
        }

        @Test
        @DisplayName("should_reject_skipping_from_pending_to_delivered")
        void should_reject_skipping_from_pending_to_delivered() {
            Order order = createValidOrder();

            assertThatThrownBy(() -> order.transitionTo(OrderStatus.DELIVERED))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("pending")
                    .hasMessageContaining("delivered");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        }

        @Test
        @DisplayName("should_record_reason_when_cancelled")
        void should_record_reason_when_cancelled() {
            Order order = createValidOrder();
            order.transitionTo(OrderStatus.CONFIRMED);

            OrderStatus previous = order.cancel("Cancelled by customer");

            assertThat(previous).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(order.getFailureReason()).isEqualTo("Cancelled by customer");
        }

        @Test
        @DisplayName("should_not_cancel_a_delivered_order")
        void should_not_cancel_a_delivered_order() {
            Order order = createValidOrder();
            order.transitionTo(OrderStatus.CONFIRMED);
            order.transitionTo(OrderStatus.PROCESSING);
            order.transitionTo(OrderStatus.SHIPPED);
            order.transitionTo(OrderStatus.DELIVERED);

            assertThatThrownBy(() -> order.cancel("too late"))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @ParameterizedTest(name = "{0} -> {1} allowed={2}")
        @CsvSource({
                "PENDING, CONFIRMED, true",
                "PENDING, CANCELLED, true",
                "PENDING, PROCESSING, false",
                "CONFIRMED, PROCESSING, true",
                "CONFIRMED, PENDING, false",
                "PROCESSING, SHIPPED, true",
                "SHIPPED, DELIVERED, true",
                "SHIPPED, CANCELLED, true",
                "DELIVERED, CANCELLED, false",
                "CANCELLED, PENDING, false"
        })
        @DisplayName("should_follow_transition_table")
        void should_follow_transition_table(OrderStatus from, OrderStatus to, boolean allowed) {
            assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
        }

        @Test
        @DisplayName("should_mark_only_confirmed_processing_shipped_as_holding_stock")
        void should_mark_only_confirmed_processing_shipped_as_holding_stock() {
            assertThat(OrderStatus.values())
                    .filteredOn(OrderStatus::holdsCommittedStock)
                    .containsExactly(OrderStatus.CONFIRMED, OrderStatus.PROCESSING, OrderStatus.SHIPPED);
        }

        @Test
        @DisplayName("should_parse_wire_names_case_insensitively")
        void should_parse_wire_names_case_insensitively() {
            assertThat(OrderStatus.fromWireName("Shipped")).isEqualTo(OrderStatus.SHIPPED);
            assertThatThrownBy(() -> OrderStatus.fromWireName("lost"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("lost");
        }
    }

    @Nested
    @DisplayName("Payment References")
    class PaymentReferences {

        @Test
        @DisplayName("should_attach_provider_order")
        void should_attach_provider_order() {
            Order order = createValidOrder();

            order.attachProviderOrder("order_P1");

            assertThat(order.getPaymentReference().providerOrderId()).isEqualTo("order_P1");
            assertThat(order.getPaymentReference().isRegistered()).isTrue();
            assertThat(order.isPaidWith("pay_1")).isFalse();
        }

        @Test
        @DisplayName("should_recognise_recorded_payment")
        void should_recognise_recorded_payment() {
            Order order = Order.reconstitute(OrderId.generate(), "user-1",
                    List.of(line("lamp-01", "10.00", 1)), "INR", ADDRESS, Instant.now(), null,
                    OrderStatus.CONFIRMED, new PaymentReference("order_P1", "pay_1", "sig"), null, false);

            assertThat(order.isPaidWith("pay_1")).isTrue();
            assertThat(order.isPaidWith("pay_2")).isFalse();
            assertThat(order.isPaidWith(null)).isFalse();
        }

        @Test
        @DisplayName("should_treat_payment_on_pending_order_as_unconfirmed")
        void should_treat_payment_on_pending_order_as_unconfirmed() {
            Order order = Order.reconstitute(OrderId.generate(), "user-1",
                    List.of(line("lamp-01", "10.00", 1)), "INR", ADDRESS, Instant.now(), null,
                    OrderStatus.PENDING, new PaymentReference("order_P1", "pay_1", "sig"), null, false);

            assertThat(order.isPaidWith("pay_1")).isFalse();
            assertThat(order.hasUnconfirmedPayment()).isTrue();
            assertThat(createValidOrder().hasUnconfirmedPayment()).isFalse();
        }
    }

    @Nested
    @DisplayName("Money Value Object")
    class MoneyTests {

        @Test
        @DisplayName("should_convert_to_minor_units")
        void should_convert_to_minor_units() {
            assertThat(Money.of(new BigDecimal("1499.5"), "INR").toMinorUnits()).isEqualTo(149950L);
            assertThat(Money.ofMinorUnits(149950L, "INR")).isEqualTo(Money.of(new BigDecimal("1499.50"), "INR"));
        }

        @Test
        @DisplayName("should_reject_negative_amount")
        void should_reject_negative_amount() {
            assertThatThrownBy(() -> Money.of(new BigDecimal("-1.00"), "INR"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should_reject_adding_different_currencies")
        void should_reject_adding_different_currencies() {
            Money inr = Money.of(new BigDecimal("1.00"), "INR");
            Money usd = Money.of(new BigDecimal("1.00"), "USD");

            assertThatThrownBy(() -> inr.add(usd))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static LineItem line(String productId, String price, int quantity) {
        ProductSnapshot snapshot = new ProductSnapshot(ProductId.of(productId), "Product " + productId,
                Money.of(new BigDecimal(price), "INR"), "home");
        return LineItem.of(snapshot, quantity);
    }

    private static Order createValidOrder() {
        return Order.create("user-1", List.of(line("lamp-01", "100.00", 1)), ADDRESS, "INR");
    }
}
