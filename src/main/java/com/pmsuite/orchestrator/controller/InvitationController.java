package com.pmsuite.orchestrator.controller;

import com.pmsuite.orchestrator.controller.dto.InvitationRequest;
import com.pmsuite.orchestrator.filter.GlobalAuthFilter;
import com.pmsuite.orchestrator.tenant.Invitation;
import com.pmsuite.orchestrator.tenant.InvitationService;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Invitations are sent within the caller's active organization and
 * answered by the invited account, whatever organization it is active in.
 */
@Tag(name = "Invitations")
@RestController
@RequestMapping("/api/v1/invitations")
public class InvitationController {

    private final InvitationService invitationService;

    public InvitationController(InvitationService invitationService) {
        this.invitationService = invitationService;
    }

    @Operation(summary = "Invite an email address into the active organization (manager or admin)")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Invitation> invite(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context,
            @Valid @RequestBody InvitationRequest request) {
        return Mono.fromCallable(() -> invitationService.invite(context, request.email(), request.role()));
    }

    @Operation(summary = "Pending invitations addressed to the caller")
    @GetMapping
    public Mono<List<Invitation>> pending(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context) {
        return Mono.fromCallable(() -> invitationService.listPending(context.principal()));
    }

    @Operation(summary = "Accept an invitation and join its organization")
    @PostMapping("/{invitationId}/accept")
    public Mono<Invitation> accept(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context,
            @PathVariable String invitationId) {
        return Mono.fromCallable(() -> invitationService.accept(context.principal(), invitationId));
    }

    @Operation(summary = "Reject an invitation")
    @PostMapping("/{invitationId}/reject")
    public Mono<Invitation> reject(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context,
            @PathVariable String invitationId) {
        return Mono.fromCallable(() -> invitationService.reject(context.principal(), invitationId));
    }
}
