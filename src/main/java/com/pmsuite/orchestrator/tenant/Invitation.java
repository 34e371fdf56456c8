package com.pmsuite.orchestrator.tenant;

import com.pmsuite.orchestrator.security.Role;

import java.time.Instant;

/**
 * Invitation to join an organization.
 *
 * Lifecycle: PENDING --accept--> ACCEPTED, PENDING --reject--> REJECTED.
 * Both targets are terminal.
 */
public record Invitation(
        String id,
        String organizationId,
        String inviteeEmail,
        Role role,
        String invitedBy,
        InvitationStatus status,
        Instant createdAt,
        Instant updatedAt) {

    public Invitation {
        inviteeEmail = UserAccount.normalizeEmail(inviteeEmail);
    }

    public Invitation withStatus(InvitationStatus newStatus, Instant at) {
        return new Invitation(id, organizationId, inviteeEmail, role, invitedBy, newStatus, createdAt, at);
    }
}
