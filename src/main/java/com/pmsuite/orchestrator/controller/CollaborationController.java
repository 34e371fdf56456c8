package com.pmsuite.orchestrator.controller;

import com.pmsuite.orchestrator.collaboration.CollaborationEmail;
import com.pmsuite.orchestrator.collaboration.CollaborationService;
import com.pmsuite.orchestrator.collaboration.CollaborationSuggestion;
import com.pmsuite.orchestrator.filter.GlobalAuthFilter;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Lab collaboration endpoints. These shadow the Labs pass-through route
 * for the /collaborations sub-path.
 */
@Tag(name = "Research collaborations")
@RestController
@RequestMapping("/api/v1/research/collaborations")
public class CollaborationController {

    private final CollaborationService collaborationService;

    public CollaborationController(CollaborationService collaborationService) {
        this.collaborationService = collaborationService;
    }

    @Operation(summary = "Ranked collaboration suggestions, recomputed on every call")
    @GetMapping
    public Mono<List<CollaborationSuggestion>> suggestions(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context) {
        return collaborationService.listSuggestions(context);
    }

    @Operation(summary = "Accepted collaborations with their current score")
    @GetMapping("/active")
    public Mono<List<CollaborationSuggestion>> active(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context) {
        return collaborationService.listAccepted(context);
    }

    @Operation(summary = "Accept a lab pair; accepting twice is a no-op")
    @PostMapping("/{labAId}/{labBId}/accept")
    public Mono<CollaborationSuggestion> accept(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context,
            @PathVariable String labAId,
            @PathVariable String labBId) {
        return collaborationService.accept(context, labAId, labBId);
    }

    @Operation(summary = "Generate an outreach email for a lab pair")
    @PostMapping("/{labAId}/{labBId}/email")
    public Mono<CollaborationEmail> email(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context,
            @PathVariable String labAId,
            @PathVariable String labBId) {
        return collaborationService.generateEmail(context, labAId, labBId);
    }
}
