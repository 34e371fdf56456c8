package com.pmsuite.orchestrator.filter;

import com.pmsuite.orchestrator.config.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RateLimitingFilterTest {

    private static final String KEY = "rate_limit:10.0.0.7:general";

    private ReactiveRedisTemplate<String, String> redisTemplate;
    private ReactiveValueOperations<String, String> valueOperations;
    private RateLimitingFilter filter;
    private AtomicInteger forwarded;
    private WebFilterChain chain;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = Mockito.mock(ReactiveRedisTemplate.class);
        valueOperations = Mockito.mock(ReactiveValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        filter = new RateLimitingFilter(redisTemplate, TestProperties.create());

        forwarded = new AtomicInteger();
        chain = exchange -> {
            forwarded.incrementAndGet();
            return Mono.empty();
        };
    }

    private static MockServerWebExchange exchange() {
        return MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/dashboard")
                .header("X-Forwarded-For", "10.0.0.7"));
    }

    @Test
    void filter_shouldStartWindowOnFirstRequest() {
        when(valueOperations.increment(KEY)).thenReturn(Mono.just(1L));
        when(redisTemplate.expire(KEY, RateLimitingFilter.RATE_LIMIT_WINDOW)).thenReturn(Mono.just(true));
        MockServerWebExchange exchange = exchange();

        filter.filter(exchange, chain).block();

        assertEquals(1, forwarded.get());
        assertEquals("3", exchange.getResponse().getHeaders().getFirst("X-RateLimit-Limit"));
        assertEquals("2", exchange.getResponse().getHeaders().getFirst("X-RateLimit-Remaining"));
        verify(redisTemplate).expire(KEY, RateLimitingFilter.RATE_LIMIT_WINDOW);
    }

    @Test
    void filter_shouldAllowRequestAtLimit() {
        when(valueOperations.increment(KEY)).thenReturn(Mono.just(3L));
        MockServerWebExchange exchange = exchange();

        filter.filter(exchange, chain).block();

        assertEquals(1, forwarded.get());
        assertEquals("0", exchange.getResponse().getHeaders().getFirst("X-RateLimit-Remaining"));
        verify(redisTemplate, never()).expire(KEY, RateLimitingFilter.RATE_LIMIT_WINDOW);
    }

    @Test
    void filter_shouldRejectRequestOverLimit() {
        when(valueOperations.increment(KEY)).thenReturn(Mono.just(4L));
        MockServerWebExchange exchange = exchange();

        filter.filter(exchange, chain).block();

        assertEquals(0, forwarded.get());
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, exchange.getResponse().getStatusCode());
        assertEquals("60", exchange.getResponse().getHeaders().getFirst("X-RateLimit-Retry-After"));
    }

    @Test
    void filter_shouldLetRequestThroughWhenRedisIsDown() {
        when(valueOperations.increment(KEY)).thenReturn(Mono.error(new RedisConnectionFailureException("down")));
        MockServerWebExchange exchange = exchange();

        filter.filter(exchange, chain).block();

        assertEquals(1, forwarded.get());
        assertNull(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Limit"));
    }
}
