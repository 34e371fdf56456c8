package com.pmsuite.orchestrator.security;

import com.pmsuite.orchestrator.config.OrchestratorProperties;
import com.pmsuite.orchestrator.proxy.BackendService;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Service trust credential signer
 *
 * Derives the short-lived credential the orchestrator attaches to every
 * backend call. It is signed with the service-trust secret (never the
 * user-token key), is audience-bound to one backend and carries the
 * original principal so the backend can repeat its own tenant checks.
 */
@Component
public class ServiceTrustSigner {

    private final SecretKey signingKey;
    private final Duration ttl;
    private final String issuer;
    private final Clock clock;

    public ServiceTrustSigner(OrchestratorProperties properties, Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(properties.serviceTrust().secret().getBytes(StandardCharsets.UTF_8));
        this.ttl = properties.serviceTrust().ttl();
        this.issuer = properties.serviceTrust().issuer();
        this.clock = clock;
    }

    /**
     * @param principal acting user, or null for calls the orchestrator makes on its own behalf (health probes)
     */
    public String sign(BackendService backend, Principal principal) {
        Instant now = clock.instant();

        JwtBuilder builder = Jwts.builder()
                .issuer(issuer)
                .audience().add(backend.serviceName()).and()
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(TokenClaims.TOKEN_TYPE, TokenClaims.TYPE_SERVICE);

        if (principal == null) {
            builder.subject(TokenClaims.SYSTEM_SUBJECT);
        } else {
            builder.subject(principal.userId())
                    .claim(TokenClaims.ORGANIZATION_ID, principal.organizationId())
                    .claim(TokenClaims.ROLE, principal.role().claimValue());
        }
        return builder.signWith(signingKey).compact();
    }
}
