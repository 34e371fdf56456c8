package com.pmsuite.orchestrator.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;

/**
 * Brute-force protection for password login.
 *
 * Blocks authentication for an account after 5 failed login attempts
 * within 60 seconds. Counters live in Redis under "login_failed:{email}"
 * and expire with the window. If Redis is unavailable, login is not blocked.
 */
@Slf4j
@Component
public class LoginAttemptTracker {

    static final int LOGIN_FAILED_LIMIT = 5;
    static final Duration FAILED_LOGIN_WINDOW = Duration.ofSeconds(60);
    private static final String LOGIN_FAILED_KEY_PREFIX = "login_failed:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    public LoginAttemptTracker(ReactiveRedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public Duration window() {
        return FAILED_LOGIN_WINDOW;
    }

    public Mono<Boolean> isAccountBlocked(String email) {
        return redisTemplate.opsForValue()
                .get(key(email))
                .defaultIfEmpty("0")
                .map(countStr -> Integer.parseInt(countStr) >= LOGIN_FAILED_LIMIT)
                .onErrorResume(e -> {
                    log.error("Login block check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    public Mono<Long> recordFailedLogin(String email) {
        String loginFailedKey = key(email);

        return redisTemplate.opsForValue()
                .increment(loginFailedKey)
                .flatMap(count -> {
                    if (count == 1) {
                        return redisTemplate.expire(loginFailedKey, FAILED_LOGIN_WINDOW)
                                .thenReturn(count);
                    }
                    return Mono.just(count);
                })
                .doOnNext(count -> {
                    if (count >= LOGIN_FAILED_LIMIT) {
                        log.warn("Account {} blocked after {} failed login attempts", email, count);
                    }
                })
                .onErrorResume(e -> {
                    log.error("Failed to record login failure: {}", e.getMessage());
                    return Mono.just(0L);
                });
    }

    public Mono<Boolean> clearFailedLogins(String email) {
        return redisTemplate.delete(key(email))
                .map(count -> count > 0)
                .onErrorResume(e -> {
                    log.error("Failed to clear login failures: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private String key(String email) {
        return LOGIN_FAILED_KEY_PREFIX + email.trim().toLowerCase(Locale.ROOT);
    }
}
