package com.pmsuite.orchestrator.tenant;

import com.pmsuite.orchestrator.exception.AuthorizationException;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tenant scope enforcement.
 *
 * A token only names an organization; the membership store decides whether
 * the caller still belongs to it and with which role.
 */
@Slf4j
@Component
public class ScopeResolver {

    private final TenantDirectory directory;

    public ScopeResolver(TenantDirectory directory) {
        this.directory = directory;
    }

    public OrganizationContext resolveScope(Principal principal) {
        Membership membership = directory.findMembership(principal.userId(), principal.organizationId())
                .orElseThrow(() -> {
                    log.warn("No membership for user {} in organization {}", principal.userId(), principal.organizationId());
                    return AuthorizationException.noActiveOrganization("No active membership in organization " + principal.organizationId());
                });
        return new OrganizationContext(principal, membership.organizationId(), membership.role());
    }

    public void authorize(OrganizationContext context, Role requiredRole) {
        if (!context.role().satisfies(requiredRole)) {
            throw AuthorizationException.forbidden(requiredRole.claimValue() + " role required");
        }
    }
}
