package com.pmsuite.orchestrator.filter;

import com.pmsuite.orchestrator.proxy.BackendService;
import com.pmsuite.orchestrator.security.HeaderConstants;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.ServiceTrustSigner;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.cloud.gateway.route.Route;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Service Trust Filter for routed traffic
 *
 * Adds the service trust credential and the caller's identity headers to
 * every request forwarded to a backend route. The end user's bearer token
 * is not forwarded; backends trust the credential instead.
 *
 * Route ids are backend service names, which selects the credential's audience.
 */
@Slf4j
@Component
public class ServiceTrustFilter implements GlobalFilter, Ordered {

    private final ServiceTrustSigner trustSigner;

    public ServiceTrustFilter(ServiceTrustSigner trustSigner) {
        this.trustSigner = trustSigner;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        Route route = exchange.getAttribute(ServerWebExchangeUtils.GATEWAY_ROUTE_ATTR);
        if (route == null) {
            return chain.filter(exchange);
        }

        BackendService backend = BackendService.fromServiceName(route.getId());
        OrganizationContext context = exchange.getAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE);
        Principal principal = context != null ? context.effectivePrincipal() : null;

        ServerHttpRequest modifiedRequest = exchange.getRequest().mutate()
                .headers(headers -> {
                    headers.remove(HttpHeaders.AUTHORIZATION);
                    headers.set(HeaderConstants.SERVICE_TOKEN, trustSigner.sign(backend, principal));
                    headers.set(HeaderConstants.SERVICE_NAME, HeaderConstants.ORCHESTRATOR_SERVICE_NAME);
                    if (principal != null) {
                        headers.set(HeaderConstants.USER_ID, principal.userId());
                        headers.set(HeaderConstants.ORGANIZATION_ID, principal.organizationId());
                        headers.set(HeaderConstants.USER_ROLE, principal.role().claimValue());
                    }
                })
                .build();

        log.debug("Adding service trust credential for {} to request: {}",
                backend.serviceName(), exchange.getRequest().getPath());

        return chain.filter(exchange.mutate().request(modifiedRequest).build());
    }

    @Override
    public int getOrder() {
        return -50;
    }
}
