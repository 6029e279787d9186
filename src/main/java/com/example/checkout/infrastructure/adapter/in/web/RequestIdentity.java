package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.domain.exception.AccessDeniedException;

/**
 * Identity headers set by the gateway's auth middleware.
 */
final class RequestIdentity {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_ROLE_HEADER = "X-User-Role";
    static final String ADMIN_ROLE = "admin";

    private RequestIdentity() {
    }

    static void requireOperator(String role) {
        if (!ADMIN_ROLE.equalsIgnoreCase(role)) {
            throw new AccessDeniedException("Operator role required");
        }
    }
}
