package com.pmsuite.orchestrator.proxy;

import com.pmsuite.orchestrator.config.OrchestratorProperties;
import com.pmsuite.orchestrator.exception.ProxyException;
import com.pmsuite.orchestrator.security.HeaderConstants;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.ServiceTrustSigner;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/*
 * ============================================================================
 * SERVICE PROXY - CODE FLOW
 * ============================================================================
 *
 *   call(service, path, method, body, context)
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. Sign service trust credential    │
 *   │    - audience = backend name        │
 *   │    - carries the acting principal   │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. Send with per-backend timeout    │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 3. Classify the outcome             │
 *   │    - 2xx          → ProxyResponse   │
 *   │    - 401          → TRUST_REJECTED  │
 *   │    - other status → BACKEND_ERROR   │
 *   │    - no answer    → TIMEOUT         │
 *   │    - no socket    → UNREACHABLE     │
 *   └─────────────────────────────────────┘
 *         │ TIMEOUT / UNREACHABLE on GET or HEAD?
 *         ▼
 *   RETRY up to maxRetries (never for POST/PUT/PATCH/DELETE)
 *
 * ============================================================================
 */

/**
 * Service Proxy
 *
 * Outbound HTTP client for the four backends. Every call is a fresh
 * credential, a bounded wait and a bounded number of retries; the proxy
 * itself keeps no state between calls.
 */
@Slf4j
@Component
public class ServiceProxy {

    private final WebClient webClient;
    private final OrchestratorProperties properties;
    private final ServiceTrustSigner trustSigner;

    public ServiceProxy(WebClient backendWebClient,
                        OrchestratorProperties properties,
                        ServiceTrustSigner trustSigner) {
        this.webClient = backendWebClient;
        this.properties = properties;
        this.trustSigner = trustSigner;
    }

    public Mono<ProxyResponse> call(BackendService service, String path, HttpMethod method, Object body,
                                    OrganizationContext context) {
        OrchestratorProperties.Backend backend = properties.backends().get(service);
        Principal principal = context == null ? null : context.effectivePrincipal();
        return call(service, path, method, body, principal, backend.timeout(), backend.maxRetries());
    }

    public Mono<ProxyResponse> get(BackendService service, String path, OrganizationContext context) {
        return call(service, path, HttpMethod.GET, null, context);
    }

    /**
     * Single unretried probe on the orchestrator's own behalf.
     */
    public Mono<ProxyResponse> probe(BackendService service, String path, Duration timeout) {
        return call(service, path, HttpMethod.GET, null, null, timeout, 0);
    }

    private Mono<ProxyResponse> call(BackendService service, String path, HttpMethod method, Object body,
                                     Principal principal, Duration timeout, int maxRetries) {
        OrchestratorProperties.Backend backend = properties.backends().get(service);
        String url = backend.baseUrl() + path;

        // Deferred so every retry attempt signs a fresh credential
        Mono<ProxyResponse> attempt = Mono.deferContextual(context -> exchange(service, url, method, body, principal,
                        context.<String>getOrDefault(HeaderConstants.CORRELATION_ID, null)))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> ProxyException.timeout(service, e))
                .onErrorMap(WebClientRequestException.class, e -> isTimeout(e)
                        ? ProxyException.timeout(service, e)
                        : ProxyException.unreachable(service, e));

        if (!isIdempotent(method) || maxRetries <= 0) {
            return attempt.doOnError(ProxyException.class, e -> logFailure(method, url, e));
        }

        return attempt
                .retryWhen(Retry.fixedDelay(maxRetries, backend.retryBackoff())
                        .filter(e -> e instanceof ProxyException proxyException && proxyException.isTransient())
                        .doBeforeRetry(signal -> log.warn("Retrying {} {} after {} (attempt {})",
                                method, url, signal.failure().getMessage(), signal.totalRetries() + 1))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnError(ProxyException.class, e -> logFailure(method, url, e));
    }

    private Mono<ProxyResponse> exchange(BackendService service, String url, HttpMethod method, Object body,
                                         Principal principal, String correlationId) {
        WebClient.RequestBodySpec request = webClient.method(method)
                .uri(url)
                .headers(headers -> {
                    headers.set(HeaderConstants.SERVICE_TOKEN, trustSigner.sign(service, principal));
                    headers.set(HeaderConstants.SERVICE_NAME, HeaderConstants.ORCHESTRATOR_SERVICE_NAME);
                    if (principal != null) {
                        headers.set(HeaderConstants.USER_ID, principal.userId());
                        headers.set(HeaderConstants.ORGANIZATION_ID, principal.organizationId());
                        headers.set(HeaderConstants.USER_ROLE, principal.role().claimValue());
                    }
                    if (correlationId != null) {
                        headers.set(HeaderConstants.CORRELATION_ID, correlationId);
                    }
                })
                .accept(MediaType.APPLICATION_JSON);

        WebClient.RequestHeadersSpec<?> spec = body == null
                ? request
                : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);

        return spec.exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(responseBody -> toResponse(service, response.statusCode().value(), responseBody)));
    }

    private ProxyResponse toResponse(BackendService service, int status, String body) {
        if (HttpStatusCode.valueOf(status).is2xxSuccessful()) {
            return new ProxyResponse(service, status, body);
        }
        if (status == HttpStatus.UNAUTHORIZED.value()) {
            throw ProxyException.trustRejected(service, status, body);
        }
        throw ProxyException.backendError(service, status, body);
    }

    private void logFailure(HttpMethod method, String url, ProxyException e) {
        if (e.getType() == ProxyException.ProxyErrorType.TRUST_REJECTED) {
            log.error("Configuration fault: {} rejected the service trust credential for {} {}",
                    e.getBackend().serviceName(), method, url);
        } else {
            log.warn("Backend call {} {} failed: {} - {}", method, url, e.getType(), e.getMessage());
        }
    }

    private static boolean isIdempotent(HttpMethod method) {
        return HttpMethod.GET.equals(method) || HttpMethod.HEAD.equals(method);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof TimeoutException || cause.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
        }
        return false;
    }
}
