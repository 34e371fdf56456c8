package com.pmsuite.orchestrator.controller;

import com.pmsuite.orchestrator.controller.dto.AuthResponse;
import com.pmsuite.orchestrator.controller.dto.LoginRequest;
import com.pmsuite.orchestrator.controller.dto.RegisterRequest;
import com.pmsuite.orchestrator.controller.dto.SwitchOrganizationRequest;
import com.pmsuite.orchestrator.filter.GlobalAuthFilter;
import com.pmsuite.orchestrator.tenant.AccountService;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Tag(name = "Authentication")
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AccountService accountService;

    public AuthController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Operation(summary = "Register an account together with its own organization")
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return accountService.register(request.email(), request.name(), request.password())
                .map(AuthResponse::from);
    }

    @Operation(summary = "Log in and receive a bearer token scoped to one organization")
    @PostMapping("/login")
    public Mono<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return accountService.login(request.email(), request.password(), request.organizationId())
                .map(AuthResponse::from);
    }

    @Operation(summary = "Current account and active organization")
    @GetMapping("/me")
    public Mono<AccountService.AccountView> me(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context) {
        return Mono.fromCallable(() -> accountService.me(context));
    }

    @Operation(summary = "Issue a new token scoped to another organization of the caller")
    @PostMapping("/switch-organization")
    public Mono<AuthResponse> switchOrganization(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context,
            @Valid @RequestBody SwitchOrganizationRequest request) {
        return Mono.fromCallable(() -> accountService.switchOrganization(context.principal(), request.organizationId()))
                .map(AuthResponse::from);
    }
}
