package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.port.in.OrderLifecycleUseCase;
import com.example.checkout.application.port.in.OrderQueryUseCase;
import com.example.checkout.infrastructure.adapter.in.web.dto.UpdateStatusRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST controller for order queries and lifecycle changes.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "Order queries, cancellation and status updates")
public class OrderController {

    private final OrderQueryUseCase queryUseCase;
    private final OrderLifecycleUseCase lifecycleUseCase;

    public OrderController(OrderQueryUseCase queryUseCase, OrderLifecycleUseCase lifecycleUseCase) {
        this.queryUseCase = queryUseCase;
        this.lifecycleUseCase = lifecycleUseCase;
    }

    @Operation(summary = "List the caller's orders", description = "Newest first")
    @GetMapping
    public Mono<ResponseEntity<List<OrderView>>> listOrders(
            @RequestHeader(RequestIdentity.USER_ID_HEADER) String userId) {
        return Mono.fromCallable(() -> queryUseCase.listOrders(userId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Get an order")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "403", description = "Order belongs to another user"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @GetMapping("/{orderId}")
    public Mono<ResponseEntity<OrderView>> getOrder(
            @RequestHeader(RequestIdentity.USER_ID_HEADER) String userId,
            @Parameter(description = "Order ID", required = true) @PathVariable String orderId) {
        return Mono.fromCallable(() -> queryUseCase.getOrder(userId, orderId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @Operation(
            summary = "Cancel an order",
            description = "Allowed until delivery. Stock committed at confirmation is returned to inventory."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order cancelled"),
            @ApiResponse(responseCode = "403", description = "Order belongs to another user"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Order is already delivered or cancelled")
    })
    @PostMapping("/{orderId}/cancel")
    public Mono<ResponseEntity<OrderView>> cancel(
            @RequestHeader(RequestIdentity.USER_ID_HEADER) String userId,
            @PathVariable String orderId) {
        return Mono.fromCallable(() -> lifecycleUseCase.cancel(userId, orderId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @Operation(
            summary = "Update order status (operator)",
            description = "Moves an order along pending → confirmed → processing → shipped → delivered, or cancels it."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status updated"),
            @ApiResponse(responseCode = "403", description = "Caller is not an operator"),
            @ApiResponse(responseCode = "409", description = "Transition not allowed from the current status")
    })
    @PutMapping("/{orderId}/status")
    public Mono<ResponseEntity<OrderView>> updateStatus(
            @RequestHeader(value = RequestIdentity.USER_ROLE_HEADER, required = false) String role,
            @PathVariable String orderId,
            @Valid @RequestBody UpdateStatusRequest request) {
        RequestIdentity.requireOperator(role);
        return Mono.fromCallable(() -> lifecycleUseCase.updateStatus(orderId, request.status()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
