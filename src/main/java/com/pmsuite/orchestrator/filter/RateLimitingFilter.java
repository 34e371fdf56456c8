package com.pmsuite.orchestrator.filter;

/*
 * ============================================================================
 * RATE LIMITING FILTER - CODE FLOW
 * ============================================================================
 *
 *   REQUEST COMES IN
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. Get client IP address            │
 *   │    - Check X-Forwarded-For header   │
 *   │    - Fallback to remote address     │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. Increment counter in Redis       │
 *   │    Key: "rate_limit:{ip}:general"   │
 *   │    TTL: 60 seconds                  │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 3. Check if limit exceeded          │
 *   │    - orchestrator.gateway.          │
 *   │      general-rate-limit per minute  │
 *   └─────────────────────────────────────┘
 *         │ YES → 429 Too Many Requests
 *         │ NO
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 4. Add rate limit headers           │
 *   │    - X-RateLimit-Limit              │
 *   │    - X-RateLimit-Remaining          │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   AUTHENTICATION AND ROUTING
 *
 * Per-account login throttling lives in LoginAttemptTracker, which the
 * login endpoint consults directly.
 *
 * ============================================================================
 */

import com.pmsuite.orchestrator.config.OrchestratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Rate Limiting Filter
 *
 * Implements per-IP rate limiting using Redis to prevent abuse.
 * If Redis is unavailable the request is let through.
 */
@Slf4j
@Component
public class RateLimitingFilter implements WebFilter, Ordered {

    static final Duration RATE_LIMIT_WINDOW = Duration.ofSeconds(60);
    private static final String RATE_LIMIT_KEY_PREFIX = "rate_limit:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final int generalRateLimit;

    public RateLimitingFilter(ReactiveRedisTemplate<String, String> redisTemplate,
                              OrchestratorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.generalRateLimit = properties.gateway().generalRateLimit();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String clientIp = LoggingFilter.getClientInfo(exchange);
        String rateLimitKey = RATE_LIMIT_KEY_PREFIX + clientIp + ":general";

        return countRequest(rateLimitKey)
                .flatMap(count -> {
                    if (count < 0) {
                        return chain.filter(exchange);
                    }
                    if (count > generalRateLimit) {
                        log.warn("Rate limit exceeded for IP: {}", clientIp);
                        exchange.getResponse().setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
                        exchange.getResponse().getHeaders()
                                .add("X-RateLimit-Retry-After", String.valueOf(RATE_LIMIT_WINDOW.getSeconds()));
                        return exchange.getResponse().setComplete();
                    }

                    exchange.getResponse().getHeaders()
                            .add("X-RateLimit-Limit", String.valueOf(generalRateLimit));
                    exchange.getResponse().getHeaders()
                            .add("X-RateLimit-Remaining", String.valueOf(Math.max(0, generalRateLimit - count)));

                    return chain.filter(exchange);
                });
    }

    /**
     * Increments the window counter. Emits -1 when Redis cannot be reached.
     */
    private Mono<Long> countRequest(String rateLimitKey) {
        return redisTemplate.opsForValue()
                .increment(rateLimitKey)
                .flatMap(count -> {
                    if (count == 1) {
                        return redisTemplate.expire(rateLimitKey, RATE_LIMIT_WINDOW)
                                .thenReturn(count);
                    }
                    return Mono.just(count);
                })
                .onErrorResume(e -> {
                    log.error("Rate limiting check failed: {}", e.getMessage());
                    return Mono.just(-1L);
                })
                .defaultIfEmpty(-1L);
    }

    @Override
    public int getOrder() {
        return -200;
    }
}
