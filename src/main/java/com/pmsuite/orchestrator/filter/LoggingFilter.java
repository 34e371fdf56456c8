package com.pmsuite.orchestrator.filter;

import com.pmsuite.orchestrator.security.HeaderConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Logging Filter
 *
 * Provides centralized request/response logging for observability.
 * Generates correlation IDs for request tracing across backends: the id is
 * forwarded on routed requests, echoed on the response, and placed in the
 * Reactor context for calls the orchestrator makes itself.
 */
@Slf4j
@Component
public class LoggingFilter implements WebFilter, Ordered {

    private static final String REQUEST_TIME_ATTR = "requestTime";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();

        // Generate or extract correlation ID for distributed tracing
        String correlationId = request.getHeaders().getFirst(HeaderConstants.CORRELATION_ID);
        if (correlationId == null || correlationId.isEmpty()) {
            correlationId = UUID.randomUUID().toString();
        }

        // Store request start time
        exchange.getAttributes().put(REQUEST_TIME_ATTR, Instant.now());

        // Add correlation ID to request headers for downstream services
        ServerHttpRequest modifiedRequest = request.mutate()
                .header(HeaderConstants.CORRELATION_ID, correlationId)
                .build();
        exchange.getResponse().getHeaders().set(HeaderConstants.CORRELATION_ID, correlationId);

        // Log incoming request
        log.info("Incoming request: {} {} - CorrelationId: {} - Client: {}",
                request.getMethod(),
                request.getURI().getPath(),
                correlationId,
                getClientInfo(exchange));

        String finalCorrelationId = correlationId;
        return chain.filter(exchange.mutate().request(modifiedRequest).build())
                .contextWrite(context -> context.put(HeaderConstants.CORRELATION_ID, finalCorrelationId))
                .doFinally(signal -> {
                    // Log response
                    Instant requestTime = exchange.getAttribute(REQUEST_TIME_ATTR);
                    long duration = requestTime != null ?
                            Instant.now().toEpochMilli() - requestTime.toEpochMilli() : 0;

                    log.info("Outgoing response: {} {} - Status: {} - Duration: {}ms - CorrelationId: {}",
                            request.getMethod(),
                            request.getURI().getPath(),
                            exchange.getResponse().getStatusCode(),
                            duration,
                            finalCorrelationId);
                });
    }

    static String getClientInfo(ServerWebExchange exchange) {
        String forwardedFor = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return forwardedFor.split(",")[0].trim();
        }

        var remoteAddress = exchange.getRequest().getRemoteAddress();
        return remoteAddress != null && remoteAddress.getAddress() != null
                ? remoteAddress.getAddress().getHostAddress()
                : "unknown";
    }

    @Override
    public int getOrder() {
        // Execute first, so rejected requests are logged too
        return -300;
    }
}
