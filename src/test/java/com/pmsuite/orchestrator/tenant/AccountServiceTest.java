package com.pmsuite.orchestrator.tenant;

import com.pmsuite.orchestrator.config.TestProperties;
import com.pmsuite.orchestrator.exception.AuthorizationException;
import com.pmsuite.orchestrator.exception.AuthorizationException.AuthzErrorType;
import com.pmsuite.orchestrator.exception.ConflictException;
import com.pmsuite.orchestrator.exception.InvalidStateException;
import com.pmsuite.orchestrator.exception.NotFoundException;
import com.pmsuite.orchestrator.exception.TooManyRequestsException;
import com.pmsuite.orchestrator.exception.UnauthorizedException;
import com.pmsuite.orchestrator.security.LoginAttemptTracker;
import com.pmsuite.orchestrator.security.MutableClock;
import com.pmsuite.orchestrator.security.PasswordService;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.Role;
import com.pmsuite.orchestrator.security.TokenService;
import com.pmsuite.orchestrator.tenant.AccountService.AuthResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AccountServiceTest {

    private InMemoryTenantDirectory directory;
    private ScopeResolver scopeResolver;
    private TokenService tokenService;
    private LoginAttemptTracker loginAttemptTracker;
    private AccountService accountService;

    @BeforeEach
    void setUp() {
        directory = new InMemoryTenantDirectory();
        scopeResolver = new ScopeResolver(directory);
        tokenService = new TokenService(TestProperties.create(), new MutableClock(Instant.parse("2025-03-01T10:00:00Z")));
        loginAttemptTracker = Mockito.mock(LoginAttemptTracker.class);
        when(loginAttemptTracker.isAccountBlocked(anyString())).thenReturn(Mono.just(false));
        when(loginAttemptTracker.recordFailedLogin(anyString())).thenReturn(Mono.just(1L));
        when(loginAttemptTracker.clearFailedLogins(anyString())).thenReturn(Mono.just(true));
        when(loginAttemptTracker.window()).thenReturn(Duration.ofMinutes(15));

        accountService = new AccountService(directory, scopeResolver,
                new PasswordService(new BCryptPasswordEncoder(4)), tokenService, loginAttemptTracker);
    }

    @Test
    void register_shouldCreateOwnedOrganizationWithAdminRole() {
        AuthResult result = accountService.register("Ada@Example.com", "Ada", "correct-horse").block();

        Principal principal = tokenService.validateToken(result.token().value());
        assertEquals(Role.ADMIN, principal.role());
        assertEquals("ada@example.com", result.user().email());
        assertEquals(principal.organizationId(), result.user().organizationId());
        assertEquals(principal.userId(),
                directory.findOrganization(principal.organizationId()).orElseThrow().ownerId());
    }

    @Test
    void register_shouldRejectDuplicateEmail() {
        accountService.register("ada@example.com", "Ada", "correct-horse").block();

        assertThrows(ConflictException.class,
                () -> accountService.register("ADA@example.com", "Other", "another-pass").block());
    }

    @Test
    void login_shouldIssueTokenAndClearFailures() {
        AuthResult registered = accountService.register("ada@example.com", "Ada", "correct-horse").block();

        AuthResult result = accountService.login("ada@example.com", "correct-horse", null).block();

        assertEquals(registered.user().id(), tokenService.validateToken(result.token().value()).userId());
        verify(loginAttemptTracker).clearFailedLogins("ada@example.com");
    }

    @Test
    void login_shouldRecordFailureForWrongPassword() {
        accountService.register("ada@example.com", "Ada", "correct-horse").block();

        assertThrows(UnauthorizedException.class,
                () -> accountService.login("ada@example.com", "wrong-password", null).block());
        verify(loginAttemptTracker).recordFailedLogin("ada@example.com");
    }

    @Test
    void login_shouldGiveSameAnswerForUnknownEmail() {
        assertThrows(UnauthorizedException.class,
                () -> accountService.login("nobody@example.com", "whatever-pass", null).block());
        verify(loginAttemptTracker).recordFailedLogin("nobody@example.com");
    }

    @Test
    void login_shouldRunPasswordCheckForUnknownEmail() {
        PasswordService passwordService = Mockito.spy(new PasswordService(new BCryptPasswordEncoder(4)));
        AccountService service = new AccountService(directory, scopeResolver, passwordService, tokenService, loginAttemptTracker);

        assertThrows(UnauthorizedException.class,
                () -> service.login("nobody@example.com", "whatever-pass", null).block());
        verify(passwordService).verifyPassword(eq("whatever-pass"), anyString());
    }

    @Test
    void login_shouldRefuseBlockedAccountWithoutCheckingPassword() {
        when(loginAttemptTracker.isAccountBlocked("ada@example.com")).thenReturn(Mono.just(true));

        TooManyRequestsException error = assertThrows(TooManyRequestsException.class,
                () -> accountService.login("ada@example.com", "correct-horse", null).block());
        assertEquals(Duration.ofMinutes(15), error.getRetryAfter());
        verify(loginAttemptTracker, never()).recordFailedLogin(anyString());
    }

    @Test
    void login_shouldRejectOrganizationWithoutMembership() {
        accountService.register("ada@example.com", "Ada", "correct-horse").block();

        AuthorizationException error = assertThrows(AuthorizationException.class,
                () -> accountService.login("ada@example.com", "correct-horse", "org-unknown").block());
        assertEquals(AuthzErrorType.NO_ACTIVE_ORGANIZATION, error.getType());
    }

    @Test
    void switchOrganization_shouldIssueTokenForOtherMembership() {
        AuthResult registered = accountService.register("ada@example.com", "Ada", "correct-horse").block();
        Principal principal = tokenService.validateToken(registered.token().value());
        directory.saveMembership(new Membership(principal.userId(), "org-second", Role.MEMBER));

        AuthResult switched = accountService.switchOrganization(principal, "org-second");

        Principal switchedPrincipal = tokenService.validateToken(switched.token().value());
        assertEquals("org-second", switchedPrincipal.organizationId());
        assertEquals(Role.MEMBER, switchedPrincipal.role());
        assertEquals(2, switched.user().memberships().size());
    }

    @Test
    void removeMember_shouldProtectOwnerAndRequireAdmin() {
        AuthResult registered = accountService.register("ada@example.com", "Ada", "correct-horse").block();
        OrganizationContext admin = scopeResolver.resolveScope(tokenService.validateToken(registered.token().value()));
        directory.saveMembership(new Membership("bob", admin.organizationId(), Role.MEMBER));

        assertThrows(InvalidStateException.class, () -> accountService.removeMember(admin, admin.userId()));

        OrganizationContext member = scopeResolver.resolveScope(new Principal("bob", admin.organizationId(), Role.MEMBER));
        assertThrows(AuthorizationException.class, () -> accountService.removeMember(member, admin.userId()));

        accountService.removeMember(admin, "bob");
        assertTrue(directory.findMembership("bob", admin.organizationId()).isEmpty());
        assertThrows(NotFoundException.class, () -> accountService.removeMember(admin, "bob"));
    }
}
