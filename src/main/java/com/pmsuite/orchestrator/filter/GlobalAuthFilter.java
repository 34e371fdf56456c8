package com.pmsuite.orchestrator.filter;

/*
 * ============================================================================
 * GLOBAL AUTH FILTER - CODE FLOW
 * ============================================================================
 *
 * This filter runs on ALL requests: orchestrator endpoints and routed
 * backend traffic alike.
 *
 *   REQUEST COMES IN
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 0. Strip client-supplied trust      │
 *   │    headers (X-User-Id, ...)         │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. Is this a public endpoint?       │
 *   │    - Check against application.yml  │
 *   │    - Supports wildcards like /**    │
 *   └─────────────────────────────────────┘
 *         │ Public? → Skip auth, forward request
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. Check Authorization header       │
 *   │    - Must exist                     │
 *   │    - Must start with "Bearer "      │
 *   └─────────────────────────────────────┘
 *         │ Missing? → 401 Unauthorized
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 3. Validate JWT token               │
 *   │    - Check signature (not tampered) │
 *   │    - Check expiration               │
 *   └─────────────────────────────────────┘
 *         │ Invalid? → 401 Unauthorized
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 4. Resolve tenant scope             │
 *   │    - Membership in token's org?     │
 *   │    - Effective role from membership │
 *   └─────────────────────────────────────┘
 *         │ No membership? → 403 Forbidden
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 5. Store OrganizationContext as an  │
 *   │    exchange attribute               │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   CONTROLLER OR DOWNSTREAM ROUTE
 *
 * ============================================================================
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmsuite.orchestrator.config.OrchestratorProperties;
import com.pmsuite.orchestrator.exception.AuthException;
import com.pmsuite.orchestrator.exception.AuthorizationException;
import com.pmsuite.orchestrator.security.HeaderConstants;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.TokenService;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import com.pmsuite.orchestrator.tenant.ScopeResolver;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global Authentication Filter
 *
 * Applies bearer-token authentication and tenant scope resolution to every
 * request that is not a public endpoint.
 * - Public endpoints: configurable via application.yml (orchestrator.gateway.public-endpoints)
 * - Trust headers are only ever set by the orchestrator itself
 */
@Slf4j
@Component
public class GlobalAuthFilter implements WebFilter, Ordered {

    // ==================== CONSTANTS ====================

    public static final String CONTEXT_ATTRIBUTE = "orchestrator.organizationContext";

    private static final String BEARER_PREFIX = "Bearer ";

    // Default public endpoints (fallback if application.yml is not configured)
    static final List<String> DEFAULT_PUBLIC_ENDPOINTS = List.of(
            "/health",
            "/api/v1/health",
            "/api/v1/services",
            "/api/v1/auth/register",
            "/api/v1/auth/login",
            "/actuator/health",
            "/v3/api-docs/**",
            "/swagger-ui/**",
            "/swagger-ui.html",
            "/webjars/**"
    );

    // ==================== INSTANCE VARIABLES ====================

    private final TokenService tokenService;
    private final ScopeResolver scopeResolver;
    private final ObjectMapper objectMapper;
    private final List<String> publicEndpoints;

    // ==================== CONSTRUCTOR ====================

    public GlobalAuthFilter(TokenService tokenService,
                            ScopeResolver scopeResolver,
                            OrchestratorProperties properties,
                            ObjectMapper objectMapper) {
        this.tokenService = tokenService;
        this.scopeResolver = scopeResolver;
        this.objectMapper = objectMapper;

        List<String> configured = properties.gateway().publicEndpoints();
        this.publicEndpoints = configured.isEmpty() ? DEFAULT_PUBLIC_ENDPOINTS : configured;
    }

    @PostConstruct
    public void init() {
        log.info("GlobalAuthFilter initialized with {} public endpoints", publicEndpoints.size());
        publicEndpoints.forEach(endpoint -> log.info("  Public endpoint: {}", endpoint));
    }

    // ==================== MAIN FILTER LOGIC ====================

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest().mutate()
                .headers(headers -> HeaderConstants.TRUSTED_HEADERS.forEach(headers::remove))
                .build();
        ServerWebExchange stripped = exchange.mutate().request(request).build();
        String path = request.getURI().getPath();

        // ========== CHECK 1: Is this a public endpoint or a CORS preflight? ==========
        if (HttpMethod.OPTIONS.equals(request.getMethod()) || isPublicEndpoint(path)) {
            log.debug("Public endpoint accessed: {}", path);
            return chain.filter(stripped);
        }

        // ========== CHECK 2: Does the request have an Authorization header? ==========
        String authHeader = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return onError(stripped, "Missing or invalid Authorization header", "UNAUTHORIZED", HttpStatus.UNAUTHORIZED);
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();

        OrganizationContext context;
        try {
            // ========== CHECK 3: Is the JWT token valid? ==========
            Principal principal = tokenService.validateToken(token);

            // ========== CHECK 4: Is the user still a member of the token's organization? ==========
            context = scopeResolver.resolveScope(principal);
        } catch (AuthException e) {
            log.warn("Token rejected for request to {}: {}", path, e.getType());
            return onError(stripped, e.getMessage(), e.getType().name(), HttpStatus.UNAUTHORIZED);
        } catch (AuthorizationException e) {
            log.warn("Scope resolution failed for request to {}: {}", path, e.getType());
            return onError(stripped, e.getMessage(), e.getType().name(), HttpStatus.FORBIDDEN);
        }

        // ========== ALL CHECKS PASSED ==========
        stripped.getAttributes().put(CONTEXT_ATTRIBUTE, context);
        return chain.filter(stripped);
    }

    @Override
    public int getOrder() {
        return -100;
    }

    // ==================== HELPER METHODS ====================

    private boolean isPublicEndpoint(String path) {
        return matchesAnyPattern(path, publicEndpoints);
    }

    /**
     * Checks if a path matches any pattern in the list
     * Supports wildcard patterns like /v3/api-docs/**
     */
    static boolean matchesAnyPattern(String path, List<String> patterns) {
        return patterns.stream()
                .anyMatch(pattern -> {
                    if (pattern.endsWith("/**")) {
                        String prefix = pattern.substring(0, pattern.length() - 3);
                        return path.equals(prefix) || path.startsWith(prefix + "/");
                    }
                    return path.equals(pattern);
                });
    }

    private Mono<Void> onError(ServerWebExchange exchange, String message, String code, HttpStatus status) {
        log.warn("Authentication failed: {} - {}", status, message);
        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().add(HeaderConstants.AUTH_ERROR, message);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("timestamp", Instant.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", status.getReasonPhrase());
        errorResponse.put("code", code);
        errorResponse.put("message", message);
        errorResponse.put("path", exchange.getRequest().getURI().getPath());

        try {
            byte[] bytes = objectMapper.writeValueAsBytes(errorResponse);
            DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        } catch (JsonProcessingException e) {
            log.error("Error serializing authentication error response", e);
            return exchange.getResponse().setComplete();
        }
    }
}
