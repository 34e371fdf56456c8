package com.pmsuite.orchestrator.security;

import com.pmsuite.orchestrator.config.OrchestratorProperties;
import com.pmsuite.orchestrator.exception.AuthException;
import com.pmsuite.orchestrator.exception.AuthException.AuthErrorType;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Credential & Token Service
 *
 * Issues and validates the end-user bearer tokens. Verification is
 * stateless: the only inputs are the token, the signing key and the clock.
 *
 * Token claims:
 * - sub  : user id
 * - org  : active organization id
 * - role : admin | manager | member
 * - iat / exp : issue time and expiry (issue time + token TTL)
 */
@Slf4j
@Component
public class TokenService {

    private final SecretKey signingKey;
    private final Duration tokenTtl;
    private final String issuer;
    private final Clock clock;

    public TokenService(OrchestratorProperties properties, Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(properties.jwt().secret().getBytes(StandardCharsets.UTF_8));
        this.tokenTtl = properties.jwt().tokenTtl();
        this.issuer = properties.jwt().issuer();
        this.clock = clock;
    }

    public IssuedToken issueToken(Principal principal) {
        // JWT dates have second precision; truncating keeps exp exactly iat + ttl
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(tokenTtl);

        String token = Jwts.builder()
                .issuer(issuer)
                .subject(principal.userId())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(TokenClaims.ORGANIZATION_ID, principal.organizationId())
                .claim(TokenClaims.ROLE, principal.role().claimValue())
                .claim(TokenClaims.TOKEN_TYPE, TokenClaims.TYPE_ACCESS)
                .signWith(signingKey)
                .compact();

        return new IssuedToken(token, issuedAt, expiresAt);
    }

    public Principal validateToken(String token) {
        Claims claims = parse(token);

        Instant now = clock.instant();
        if (claims.getExpiration() == null || !now.isBefore(claims.getExpiration().toInstant())) {
            throw new AuthException(AuthErrorType.EXPIRED, "Token has expired");
        }
        if (!TokenClaims.TYPE_ACCESS.equals(claims.get(TokenClaims.TOKEN_TYPE, String.class))) {
            throw new AuthException(AuthErrorType.MALFORMED, "Token is not an access token");
        }

        String userId = claims.getSubject();
        String organizationId = claims.get(TokenClaims.ORGANIZATION_ID, String.class);
        Role role = Role.fromClaim(claims.get(TokenClaims.ROLE, String.class));
        if (isBlank(userId) || isBlank(organizationId) || role == null) {
            throw new AuthException(AuthErrorType.MALFORMED, "Token is missing identity claims");
        }
        return new Principal(userId, organizationId, role);
    }

    private Claims parse(String token) {
        if (isBlank(token)) {
            throw new AuthException(AuthErrorType.MALFORMED, "Token is empty");
        }
        try {
            return Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorType.EXPIRED, "Token has expired", e);
        } catch (ClaimJwtException | SecurityException e) {
            log.debug("Token signature or issuer rejected: {}", e.getMessage());
            throw new AuthException(AuthErrorType.INVALID, "Token was not issued by this gateway", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token could not be parsed: {}", e.getMessage());
            throw new AuthException(AuthErrorType.MALFORMED, "Token is malformed", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
