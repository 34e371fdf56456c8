package com.pmsuite.orchestrator.tenant;

import com.pmsuite.orchestrator.exception.AuthorizationException;
import com.pmsuite.orchestrator.exception.ConflictException;
import com.pmsuite.orchestrator.exception.InvalidStateException;
import com.pmsuite.orchestrator.exception.NotFoundException;
import com.pmsuite.orchestrator.exception.TooManyRequestsException;
import com.pmsuite.orchestrator.exception.UnauthorizedException;
import com.pmsuite.orchestrator.security.IssuedToken;
import com.pmsuite.orchestrator.security.LoginAttemptTracker;
import com.pmsuite.orchestrator.security.PasswordService;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.Role;
import com.pmsuite.orchestrator.security.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account registration, login and organization membership management.
 *
 * Password hashing is CPU bound, so hashing and verification run on the
 * bounded elastic scheduler instead of the event loop.
 */
@Slf4j
@Service
public class AccountService {

    private final TenantDirectory directory;
    private final ScopeResolver scopeResolver;
    private final PasswordService passwordService;
    private final TokenService tokenService;
    private final LoginAttemptTracker loginAttemptTracker;
    private final String unknownAccountHash;

    public AccountService(TenantDirectory directory,
                          ScopeResolver scopeResolver,
                          PasswordService passwordService,
                          TokenService tokenService,
                          LoginAttemptTracker loginAttemptTracker) {
        this.directory = directory;
        this.scopeResolver = scopeResolver;
        this.passwordService = passwordService;
        this.tokenService = tokenService;
        this.loginAttemptTracker = loginAttemptTracker;
        this.unknownAccountHash = passwordService.hashPassword(UUID.randomUUID().toString());
    }

    /**
     * Registers an account together with its own organization, in which the
     * new user is owner and admin.
     */
    public Mono<AuthResult> register(String email, String name, String password) {
        return Mono.fromCallable(() -> passwordService.hashPassword(password))
                .subscribeOn(Schedulers.boundedElastic())
                .map(passwordHash -> {
                    UserAccount user = new UserAccount(UUID.randomUUID().toString(), email, name, passwordHash, true);
                    if (!directory.createUser(user)) {
                        throw new ConflictException("Email already registered");
                    }
                    Organization organization = new Organization(
                            UUID.randomUUID().toString(), name + "'s Organization", null, user.id());
                    directory.saveOrganization(organization);
                    directory.saveMembership(new Membership(user.id(), organization.id(), Role.ADMIN));
                    log.info("Registered user {} with organization {}", user.id(), organization.id());
                    return authResult(user, new Principal(user.id(), organization.id(), Role.ADMIN));
                });
    }

    /**
     * @param organizationId organization to activate, or null for the user's first membership
     */
    public Mono<AuthResult> login(String email, String password, String organizationId) {
        return loginAttemptTracker.isAccountBlocked(email)
                .flatMap(blocked -> {
                    if (blocked) {
                        return Mono.<Optional<UserAccount>>error(new TooManyRequestsException(
                                "Too many failed login attempts. Try again later.", loginAttemptTracker.window()));
                    }
                    return verifyCredentials(email, password);
                })
                .flatMap(user -> {
                    if (user.isEmpty()) {
                        return loginAttemptTracker.recordFailedLogin(email)
                                .then(Mono.<AuthResult>error(new UnauthorizedException("Invalid credentials")));
                    }
                    UserAccount account = user.get();
                    if (!account.active()) {
                        return Mono.<AuthResult>error(AuthorizationException.forbidden("User account is inactive"));
                    }
                    Principal principal = principalFor(account, organizationId);
                    return loginAttemptTracker.clearFailedLogins(email)
                            .thenReturn(authResult(account, principal));
                });
    }

    public AuthResult switchOrganization(Principal principal, String organizationId) {
        UserAccount account = directory.findUserById(principal.userId())
                .orElseThrow(() -> new NotFoundException("Account not found"));
        return authResult(account, principalFor(account, organizationId));
    }

    public Organization createOrganization(Principal principal, String name, String description) {
        Organization organization = new Organization(UUID.randomUUID().toString(), name, description, principal.userId());
        directory.saveOrganization(organization);
        directory.saveMembership(new Membership(principal.userId(), organization.id(), Role.ADMIN));
        log.info("User {} created organization {}", principal.userId(), organization.id());
        return organization;
    }

    public void removeMember(OrganizationContext context, String userId) {
        scopeResolver.authorize(context, Role.ADMIN);
        Organization organization = directory.findOrganization(context.organizationId())
                .orElseThrow(() -> new NotFoundException("Organization not found"));
        if (organization.ownerId().equals(userId)) {
            throw new InvalidStateException("The organization owner cannot be removed");
        }
        if (!directory.removeMembership(userId, context.organizationId())) {
            throw new NotFoundException("User " + userId + " is not a member of this organization");
        }
        log.info("User {} removed {} from organization {}", context.userId(), userId, context.organizationId());
    }

    public AccountView me(OrganizationContext context) {
        UserAccount account = directory.findUserById(context.userId())
                .orElseThrow(() -> new NotFoundException("Account not found"));
        return AccountView.of(account, context.organizationId(), context.role(), directory.findMemberships(account.id()));
    }

    private Mono<Optional<UserAccount>> verifyCredentials(String email, String password) {
        Optional<UserAccount> candidate = directory.findUserByEmail(email);
        // unknown emails pay the same BCrypt cost as known ones
        String passwordHash = candidate.map(UserAccount::passwordHash).orElse(unknownAccountHash);
        return Mono.fromCallable(() -> passwordService.verifyPassword(password, passwordHash) && candidate.isPresent()
                        ? candidate
                        : Optional.<UserAccount>empty())
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Principal principalFor(UserAccount account, String organizationId) {
        List<Membership> memberships = directory.findMemberships(account.id());
        Membership membership;
        if (organizationId == null || organizationId.isBlank()) {
            membership = memberships.stream().findFirst()
                    .orElseThrow(() -> AuthorizationException.noActiveOrganization("User has no organization membership"));
        } else {
            membership = memberships.stream()
                    .filter(candidate -> candidate.organizationId().equals(organizationId))
                    .findFirst()
                    .orElseThrow(() -> AuthorizationException.noActiveOrganization("No membership in organization " + organizationId));
        }
        return new Principal(account.id(), membership.organizationId(), membership.role());
    }

    private AuthResult authResult(UserAccount account, Principal principal) {
        IssuedToken token = tokenService.issueToken(principal);
        AccountView view = AccountView.of(account, principal.organizationId(), principal.role(),
                directory.findMemberships(account.id()));
        return new AuthResult(token, view);
    }

    public record AuthResult(IssuedToken token, AccountView user) {
    }

    /**
     * Account as exposed to clients; never includes the password hash.
     */
    public record AccountView(
            String id,
            String email,
            String name,
            boolean active,
            String organizationId,
            Role role,
            List<Membership> memberships) {

        static AccountView of(UserAccount account, String organizationId, Role role, List<Membership> memberships) {
            return new AccountView(account.id(), account.email(), account.name(), account.active(),
                    organizationId, role, memberships);
        }
    }
}
