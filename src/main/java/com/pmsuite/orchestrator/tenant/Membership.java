package com.pmsuite.orchestrator.tenant;

import com.pmsuite.orchestrator.security.Role;

public record Membership(String userId, String organizationId, Role role) {
}
