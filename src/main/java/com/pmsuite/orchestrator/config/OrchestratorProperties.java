package com.pmsuite.orchestrator.config;

import com.pmsuite.orchestrator.collaboration.CollaborationScope;
import com.pmsuite.orchestrator.proxy.BackendService;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Orchestrator configuration.
 *
 * Bound once at startup from application.yml (prefix "orchestrator") and
 * injected by reference into every component. All nested sections are
 * records, so the bound object is immutable for the life of the process.
 */
@ConfigurationProperties(prefix = "orchestrator")
public record OrchestratorProperties(
        Jwt jwt,
        ServiceTrust serviceTrust,
        Backends backends,
        Aggregation aggregation,
        Collaboration collaboration,
        Gateway gateway) {

    public OrchestratorProperties {
        if (jwt == null || jwt.secret() == null || jwt.secret().isBlank()) {
            throw new IllegalStateException("orchestrator.jwt.secret is not configured");
        }
        if (serviceTrust == null || serviceTrust.secret() == null || serviceTrust.secret().isBlank()) {
            throw new IllegalStateException("orchestrator.service-trust.secret is not configured");
        }
        if (jwt.secret().equals(serviceTrust.secret())) {
            throw new IllegalStateException("orchestrator.service-trust.secret must differ from orchestrator.jwt.secret");
        }
        if (backends == null) {
            throw new IllegalStateException("orchestrator.backends is not configured");
        }
        aggregation = aggregation == null ? new Aggregation(null, null) : aggregation;
        collaboration = collaboration == null ? new Collaboration(null, null) : collaboration;
        gateway = gateway == null ? new Gateway(null, 0) : gateway;
    }

    /**
     * End-user bearer token settings.
     */
    public record Jwt(String secret, Duration tokenTtl, String issuer) {

        public Jwt {
            tokenTtl = tokenTtl == null ? Duration.ofDays(7) : tokenTtl;
            issuer = issuer == null || issuer.isBlank() ? "pm-orchestrator" : issuer;
        }
    }

    /**
     * Credential attached to every outbound backend call.
     */
    public record ServiceTrust(String secret, Duration ttl, String issuer) {

        public ServiceTrust {
            ttl = ttl == null ? Duration.ofSeconds(60) : ttl;
            issuer = issuer == null || issuer.isBlank() ? "pm-orchestrator" : issuer;
        }
    }

    public record Backends(Backend atlas, Backend workpulse, Backend epr, Backend labs) {

        public Backends {
            require(atlas, BackendService.ATLAS);
            require(workpulse, BackendService.WORKPULSE);
            require(epr, BackendService.EPR);
            require(labs, BackendService.LABS);
        }

        public Backend get(BackendService service) {
            return switch (service) {
                case ATLAS -> atlas;
                case WORKPULSE -> workpulse;
                case EPR -> epr;
                case LABS -> labs;
            };
        }

        private static void require(Backend backend, BackendService service) {
            if (backend == null || backend.baseUrl() == null || backend.baseUrl().isBlank()) {
                throw new IllegalStateException("orchestrator.backends." + service.serviceName() + ".base-url is not configured");
            }
        }
    }

    public record Backend(String baseUrl, Duration timeout, Integer maxRetries, Duration retryBackoff) {

        public Backend {
            baseUrl = baseUrl == null ? null : stripTrailingSlash(baseUrl.trim());
            timeout = timeout == null ? Duration.ofSeconds(3) : timeout;
            maxRetries = maxRetries == null ? 2 : Math.max(0, maxRetries);
            retryBackoff = retryBackoff == null ? Duration.ofMillis(100) : retryBackoff;
        }

        private static String stripTrailingSlash(String url) {
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }

    /**
     * Fan-out limits. The deadline bounds every dashboard branch; health
     * probes use their own shorter timeout.
     */
    public record Aggregation(Duration deadline, Duration healthTimeout) {

        public Aggregation {
            deadline = deadline == null ? Duration.ofSeconds(5) : deadline;
            healthTimeout = healthTimeout == null ? Duration.ofSeconds(2) : healthTimeout;
        }
    }

    public record Collaboration(CollaborationScope scope, String senderSignature) {

        public Collaboration {
            scope = scope == null ? CollaborationScope.ORGANIZATION : scope;
            senderSignature = senderSignature == null || senderSignature.isBlank()
                    ? "Research Collaboration System"
                    : senderSignature;
        }
    }

    public record Gateway(List<String> publicEndpoints, int generalRateLimit) {

        public Gateway {
            publicEndpoints = publicEndpoints == null ? List.of() : List.copyOf(publicEndpoints);
            generalRateLimit = generalRateLimit <= 0 ? 100 : generalRateLimit;
        }
    }
}
