package com.pmsuite.orchestrator.controller.dto;

import com.pmsuite.orchestrator.tenant.AccountService;

import java.time.Instant;

public record AuthResponse(String accessToken, String tokenType, Instant expiresAt, AccountService.AccountView user) {

    public static AuthResponse from(AccountService.AuthResult result) {
        return new AuthResponse(result.token().value(), "bearer", result.token().expiresAt(), result.user());
    }
}
