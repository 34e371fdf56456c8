package com.pmsuite.orchestrator.security;

import java.util.Objects;

/**
 * Authenticated identity, tenant and role as carried in signed token claims.
 * Never built from request bodies.
 */
public record Principal(String userId, String organizationId, Role role) {

    public Principal {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(role, "role");
    }
}
