package com.pmsuite.orchestrator.tenant;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local tenant directory backed by concurrent maps.
 */
@Component
public class InMemoryTenantDirectory implements TenantDirectory {

    private final Map<String, UserAccount> usersById = new ConcurrentHashMap<>();
    private final Map<String, String> userIdsByEmail = new ConcurrentHashMap<>();
    private final Map<String, Organization> organizations = new ConcurrentHashMap<>();
    private final Map<MembershipKey, Membership> memberships = new ConcurrentHashMap<>();
    private final Map<String, Invitation> invitations = new ConcurrentHashMap<>();

    @Override
    public boolean createUser(UserAccount user) {
        // the account must exist before its email becomes resolvable
        if (usersById.putIfAbsent(user.id(), user) != null) {
            return false;
        }
        if (userIdsByEmail.putIfAbsent(user.email(), user.id()) != null) {
            usersById.remove(user.id(), user);
            return false;
        }
        return true;
    }

    @Override
    public Optional<UserAccount> findUserById(String userId) {
        return Optional.ofNullable(usersById.get(userId));
    }

    @Override
    public Optional<UserAccount> findUserByEmail(String email) {
        String userId = userIdsByEmail.get(UserAccount.normalizeEmail(email));
        return userId == null ? Optional.empty() : findUserById(userId);
    }

    @Override
    public void saveOrganization(Organization organization) {
        organizations.put(organization.id(), organization);
    }

    @Override
    public Optional<Organization> findOrganization(String organizationId) {
        return Optional.ofNullable(organizations.get(organizationId));
    }

    @Override
    public void saveMembership(Membership membership) {
        memberships.put(new MembershipKey(membership.userId(), membership.organizationId()), membership);
    }

    @Override
    public Optional<Membership> findMembership(String userId, String organizationId) {
        return Optional.ofNullable(memberships.get(new MembershipKey(userId, organizationId)));
    }

    @Override
    public List<Membership> findMemberships(String userId) {
        return memberships.values().stream()
                .filter(membership -> membership.userId().equals(userId))
                .sorted(Comparator.comparing(Membership::organizationId))
                .toList();
    }

    @Override
    public boolean removeMembership(String userId, String organizationId) {
        return memberships.remove(new MembershipKey(userId, organizationId)) != null;
    }

    @Override
    public void saveInvitation(Invitation invitation) {
        invitations.put(invitation.id(), invitation);
    }

    @Override
    public List<Invitation> findPendingInvitations(String email) {
        String normalized = UserAccount.normalizeEmail(email);
        return invitations.values().stream()
                .filter(invitation -> invitation.status() == InvitationStatus.PENDING)
                .filter(invitation -> invitation.inviteeEmail().equals(normalized))
                .sorted(Comparator.comparing(Invitation::createdAt))
                .toList();
    }

    @Override
    public Optional<Invitation> updateInvitation(String invitationId, UnaryOperator<Invitation> update) {
        return Optional.ofNullable(invitations.computeIfPresent(invitationId, (id, current) -> update.apply(current)));
    }

    private record MembershipKey(String userId, String organizationId) {
    }
}
