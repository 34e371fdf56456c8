package com.pmsuite.orchestrator.controller;

import com.pmsuite.orchestrator.controller.dto.CreateOrganizationRequest;
import com.pmsuite.orchestrator.filter.GlobalAuthFilter;
import com.pmsuite.orchestrator.tenant.AccountService;
import com.pmsuite.orchestrator.tenant.Organization;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Tag(name = "Organizations")
@RestController
@RequestMapping("/api/v1/organizations")
public class OrganizationController {

    private final AccountService accountService;

    public OrganizationController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Operation(summary = "Create an organization owned by the caller")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Organization> create(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context,
            @Valid @RequestBody CreateOrganizationRequest request) {
        return Mono.fromCallable(() ->
                accountService.createOrganization(context.principal(), request.name(), request.description()));
    }

    @Operation(summary = "Remove a member from the active organization (admin only)")
    @DeleteMapping("/current/members/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> removeMember(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context,
            @PathVariable String userId) {
        return Mono.fromRunnable(() -> accountService.removeMember(context, userId));
    }
}
