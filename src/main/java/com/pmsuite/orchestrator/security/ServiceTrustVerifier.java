package com.pmsuite.orchestrator.security;

import com.pmsuite.orchestrator.exception.AuthException;
import com.pmsuite.orchestrator.exception.AuthException.AuthErrorType;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.Optional;

/**
 * Backend-side verification of the service trust credential.
 *
 * Not a Spring bean: each backend builds one with the shared service-trust
 * secret and its own service name as the expected audience.
 */
public class ServiceTrustVerifier {

    private final SecretKey verificationKey;
    private final String expectedIssuer;
    private final String audience;
    private final Clock clock;

    public ServiceTrustVerifier(String serviceTrustSecret, String expectedIssuer, String audience, Clock clock) {
        this.verificationKey = Keys.hmacShaKeyFor(serviceTrustSecret.getBytes(StandardCharsets.UTF_8));
        this.expectedIssuer = expectedIssuer;
        this.audience = audience;
        this.clock = clock;
    }

    /**
     * @return the principal the call is made for, or empty for orchestrator system calls
     */
    public Optional<Principal> verify(String credential) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(verificationKey)
                    .requireIssuer(expectedIssuer)
                    .requireAudience(audience)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(credential)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorType.EXPIRED, "Service credential has expired", e);
        } catch (ClaimJwtException | SecurityException e) {
            throw new AuthException(AuthErrorType.INVALID, "Service credential rejected", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorType.MALFORMED, "Service credential is malformed", e);
        }

        if (!TokenClaims.TYPE_SERVICE.equals(claims.get(TokenClaims.TOKEN_TYPE, String.class))) {
            throw new AuthException(AuthErrorType.INVALID, "Not a service credential");
        }
        if (TokenClaims.SYSTEM_SUBJECT.equals(claims.getSubject())) {
            return Optional.empty();
        }

        String organizationId = claims.get(TokenClaims.ORGANIZATION_ID, String.class);
        Role role = Role.fromClaim(claims.get(TokenClaims.ROLE, String.class));
        if (claims.getSubject() == null || organizationId == null || role == null) {
            throw new AuthException(AuthErrorType.MALFORMED, "Service credential is missing principal claims");
        }
        return Optional.of(new Principal(claims.getSubject(), organizationId, role));
    }
}
