package com.pmsuite.orchestrator.tenant;

import com.pmsuite.orchestrator.exception.AuthorizationException;
import com.pmsuite.orchestrator.exception.ConflictException;
import com.pmsuite.orchestrator.exception.InvalidStateException;
import com.pmsuite.orchestrator.exception.NotFoundException;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Organization invitations.
 *
 * Managers and admins invite by email. Only the account registered under
 * that email may answer, and an invitation can be answered exactly once.
 * Accepting never changes an existing membership.
 */
@Slf4j
@Service
public class InvitationService {

    private final TenantDirectory directory;
    private final ScopeResolver scopeResolver;
    private final Clock clock;

    public InvitationService(TenantDirectory directory, ScopeResolver scopeResolver, Clock clock) {
        this.directory = directory;
        this.scopeResolver = scopeResolver;
        this.clock = clock;
    }

    public Invitation invite(OrganizationContext context, String email, Role role) {
        scopeResolver.authorize(context, Role.MANAGER);
        Role grantedRole = role == null ? Role.MEMBER : role;
        if (!context.role().satisfies(grantedRole)) {
            throw AuthorizationException.forbidden("Cannot grant a role above your own");
        }

        Instant now = clock.instant();
        Invitation invitation = new Invitation(
                UUID.randomUUID().toString(),
                context.organizationId(),
                email,
                grantedRole,
                context.userId(),
                InvitationStatus.PENDING,
                now,
                now);
        directory.saveInvitation(invitation);
        log.info("User {} invited {} to organization {} as {}",
                context.userId(), invitation.inviteeEmail(), context.organizationId(), grantedRole);
        return invitation;
    }

    public List<Invitation> listPending(Principal principal) {
        return directory.findPendingInvitations(accountOf(principal).email());
    }

    public Invitation accept(Principal principal, String invitationId) {
        Invitation accepted = transition(principal, invitationId, InvitationStatus.ACCEPTED, current -> {
            if (directory.findMembership(principal.userId(), current.organizationId()).isPresent()) {
                throw new ConflictException("User is already a member of this organization");
            }
        });
        directory.saveMembership(new Membership(principal.userId(), accepted.organizationId(), accepted.role()));
        log.info("User {} joined organization {} as {}", principal.userId(), accepted.organizationId(), accepted.role());
        return accepted;
    }

    public Invitation reject(Principal principal, String invitationId) {
        return transition(principal, invitationId, InvitationStatus.REJECTED, current -> { });
    }

    private Invitation transition(Principal principal, String invitationId, InvitationStatus target,
                                  Consumer<Invitation> guard) {
        UserAccount account = accountOf(principal);
        return directory.updateInvitation(invitationId, current -> {
                    if (!current.inviteeEmail().equals(account.email())) {
                        throw AuthorizationException.forbidden("Invitation was issued to another email");
                    }
                    if (current.status().isTerminal()) {
                        throw new InvalidStateException("Invitation is already " + current.status().name().toLowerCase(Locale.ROOT));
                    }
                    guard.accept(current);
                    return current.withStatus(target, clock.instant());
                })
                .orElseThrow(() -> new NotFoundException("Invitation not found: " + invitationId));
    }

    private UserAccount accountOf(Principal principal) {
        return directory.findUserById(principal.userId())
                .orElseThrow(() -> new NotFoundException("Account not found"));
    }
}
