package com.pmsuite.orchestrator.tenant;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Store of accounts, organizations, memberships and invitations.
 */
public interface TenantDirectory {

    /**
     * @return false when an account with the same email already exists
     */
    boolean createUser(UserAccount user);

    Optional<UserAccount> findUserById(String userId);

    Optional<UserAccount> findUserByEmail(String email);

    void saveOrganization(Organization organization);

    Optional<Organization> findOrganization(String organizationId);

    void saveMembership(Membership membership);

    Optional<Membership> findMembership(String userId, String organizationId);

    List<Membership> findMemberships(String userId);

    boolean removeMembership(String userId, String organizationId);

    void saveInvitation(Invitation invitation);

    List<Invitation> findPendingInvitations(String email);

    /**
     * Atomically replaces an invitation with the result of {@code update}.
     * Exceptions thrown by {@code update} propagate and leave the stored
     * invitation unchanged.
     */
    Optional<Invitation> updateInvitation(String invitationId, UnaryOperator<Invitation> update);
}
