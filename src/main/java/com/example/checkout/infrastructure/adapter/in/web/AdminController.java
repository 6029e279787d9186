package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.port.in.OrderQueryUseCase;
import com.example.checkout.infrastructure.notification.NotificationInboxService;
import com.example.checkout.infrastructure.notification.NotificationInboxService.NotificationView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Operator endpoints: stale pending orders and the notification inbox.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin", description = "Operator views")
public class AdminController {

    private final OrderQueryUseCase queryUseCase;
    private final NotificationInboxService inboxService;
    private final long defaultThresholdMinutes;

    public AdminController(
            OrderQueryUseCase queryUseCase,
            NotificationInboxService inboxService,
            @Value("${checkout.stale-pending.threshold-minutes:30}") long defaultThresholdMinutes) {
        this.queryUseCase = queryUseCase;
        this.inboxService = inboxService;
        this.defaultThresholdMinutes = defaultThresholdMinutes;
    }

    @Operation(summary = "Pending orders older than a threshold")
    @GetMapping("/orders/stale-pending")
    public Mono<ResponseEntity<List<OrderView>>> stalePending(
            @RequestHeader(value = RequestIdentity.USER_ROLE_HEADER, required = false) String role,
            @Parameter(description = "Age threshold, defaults to checkout.stale-pending.threshold-minutes")
            @RequestParam(required = false) Long olderThanMinutes) {
        RequestIdentity.requireOperator(role);
        long minutes = olderThanMinutes != null ? olderThanMinutes : defaultThresholdMinutes;
        if (minutes < 0) {
            throw new IllegalArgumentException("olderThanMinutes must not be negative");
        }
        return Mono.fromCallable(() -> queryUseCase.findStalePending(Duration.ofMinutes(minutes)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Operator notifications, newest first")
    @GetMapping("/notifications")
    public Mono<ResponseEntity<List<NotificationView>>> notifications(
            @RequestHeader(value = RequestIdentity.USER_ROLE_HEADER, required = false) String role,
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @RequestParam(defaultValue = "50") int limit) {
        RequestIdentity.requireOperator(role);
        return Mono.fromCallable(() -> inboxService.list(unreadOnly, limit))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Mark a notification as read")
    @PatchMapping("/notifications/{id}/read")
    public Mono<ResponseEntity<Void>> markRead(
            @RequestHeader(value = RequestIdentity.USER_ROLE_HEADER, required = false) String role,
            @PathVariable Long id) {
        RequestIdentity.requireOperator(role);
        return Mono.fromCallable(() -> inboxService.markRead(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(found -> found
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
