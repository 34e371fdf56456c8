package com.pmsuite.orchestrator.config;

import com.pmsuite.orchestrator.proxy.BackendService;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.cloud.circuitbreaker.resilience4j.ReactiveResilience4JCircuitBreakerFactory;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JConfigBuilder;
import org.springframework.cloud.client.circuitbreaker.Customizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker defaults for the proxied routes.
 *
 * The time limiter sits above the route response timeout plus retries so
 * that the route timeout, not the breaker, decides when a call is too slow.
 */
@Configuration
public class Resilience4jConfig {

    @Bean
    public Customizer<ReactiveResilience4JCircuitBreakerFactory> defaultCustomizer(OrchestratorProperties properties) {
        Duration slowest = Duration.ZERO;
        for (BackendService service : BackendService.values()) {
            OrchestratorProperties.Backend backend = properties.backends().get(service);
            Duration budget = backend.timeout().multipliedBy(backend.maxRetries() + 1L);
            if (budget.compareTo(slowest) > 0) {
                slowest = budget;
            }
        }
        Duration timeLimit = slowest.plusSeconds(1);

        return factory -> factory.configureDefault(id -> new Resilience4JConfigBuilder(id)
                .circuitBreakerConfig(CircuitBreakerConfig.custom()
                        .failureRateThreshold(50)
                        .slowCallRateThreshold(50)
                        .slowCallDurationThreshold(Duration.ofSeconds(3))
                        .permittedNumberOfCallsInHalfOpenState(5)
                        .slidingWindowSize(10)
                        .minimumNumberOfCalls(5)
                        .waitDurationInOpenState(Duration.ofSeconds(30))
                        .build())
                .timeLimiterConfig(TimeLimiterConfig.custom()
                        .timeoutDuration(timeLimit)
                        .build())
                .build());
    }
}
