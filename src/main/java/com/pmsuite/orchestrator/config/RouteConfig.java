package com.pmsuite.orchestrator.config;

import com.pmsuite.orchestrator.proxy.BackendService;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.GatewayFilterSpec;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.cloud.gateway.support.RouteMetadataUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Route Configuration for the Orchestrator
 *
 * Defines pass-through routes to the four backends. Base URLs come from
 * orchestrator.backends; route ids are the backend service names, which
 * ServiceTrustFilter uses as the credential audience.
 *
 * Orchestrator endpoints (dashboard, collaborations, ...) are annotated
 * controllers and take precedence over these routes.
 */
@Configuration
public class RouteConfig {

    private final OrchestratorProperties properties;

    public RouteConfig(OrchestratorProperties properties) {
        this.properties = properties;
    }

    @Bean
    public RouteLocator customRouteLocator(RouteLocatorBuilder builder) {
        return builder.routes()
                // Atlas - projects, tasks and issues
                .route(BackendService.ATLAS.serviceName(), r -> r
                        .path("/api/v1/projects/**", "/api/v1/tasks/**", "/api/v1/issues/**")
                        .filters(f -> resilience(f, BackendService.ATLAS))
                        .metadata(RouteMetadataUtils.RESPONSE_TIMEOUT_ATTR, timeoutMillis(BackendService.ATLAS))
                        .uri(baseUrl(BackendService.ATLAS)))

                // WorkPulse - activity monitoring
                .route(BackendService.WORKPULSE.serviceName(), r -> r
                        .path("/api/v1/activity/**", "/api/v1/productivity/**")
                        .filters(f -> resilience(f, BackendService.WORKPULSE))
                        .metadata(RouteMetadataUtils.RESPONSE_TIMEOUT_ATTR, timeoutMillis(BackendService.WORKPULSE))
                        .uri(baseUrl(BackendService.WORKPULSE)))

                // EPR - goals, reviews and feedback
                .route(BackendService.EPR.serviceName(), r -> r
                        .path("/api/v1/goals/**", "/api/v1/reviews/**", "/api/v1/feedback/**", "/api/v1/analytics/**")
                        .filters(f -> resilience(f, BackendService.EPR))
                        .metadata(RouteMetadataUtils.RESPONSE_TIMEOUT_ATTR, timeoutMillis(BackendService.EPR))
                        .uri(baseUrl(BackendService.EPR)))

                // Labs - mounted at the backend root
                .route(BackendService.LABS.serviceName(), r -> r
                        .path("/api/v1/research/**")
                        .filters(f -> resilience(f
                                .rewritePath("/api/v1/research/(?<segment>.*)", "/${segment}"), BackendService.LABS))
                        .metadata(RouteMetadataUtils.RESPONSE_TIMEOUT_ATTR, timeoutMillis(BackendService.LABS))
                        .uri(baseUrl(BackendService.LABS)))

                .build();
    }

    private GatewayFilterSpec resilience(GatewayFilterSpec filters, BackendService service) {
        OrchestratorProperties.Backend backend = properties.backends().get(service);
        return filters
                .circuitBreaker(c -> c
                        .setName(service.serviceName() + "CircuitBreaker")
                        .setFallbackUri("forward:/fallback/" + service.serviceName()))
                // Only idempotent methods, and only when no response arrived
                .retry(c -> c
                        .setRetries(backend.maxRetries())
                        .setMethods(HttpMethod.GET, HttpMethod.HEAD)
                        .setSeries()
                        .setExceptions(IOException.class, TimeoutException.class)
                        .setBackoff(backend.retryBackoff(), backend.retryBackoff(), 1, false));
    }

    private String baseUrl(BackendService service) {
        return properties.backends().get(service).baseUrl();
    }

    private long timeoutMillis(BackendService service) {
        return properties.backends().get(service).timeout().toMillis();
    }
}
