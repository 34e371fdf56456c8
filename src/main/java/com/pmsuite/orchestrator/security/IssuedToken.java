package com.pmsuite.orchestrator.security;

import java.time.Instant;

public record IssuedToken(String value, Instant issuedAt, Instant expiresAt) {
}
