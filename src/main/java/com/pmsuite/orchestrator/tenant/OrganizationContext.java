package com.pmsuite.orchestrator.tenant;

import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.Role;

/**
 * Resolved tenant scope of one request: the organization every read and
 * write is confined to and the caller's current role in it.
 */
public record OrganizationContext(Principal principal, String organizationId, Role role) {

    public String userId() {
        return principal.userId();
    }

    /**
     * Principal with the effective membership role, which wins over a
     * possibly stale role claim in the token.
     */
    public Principal effectivePrincipal() {
        return new Principal(principal.userId(), organizationId, role);
    }
}
