package com.pmsuite.orchestrator.config;

import com.pmsuite.orchestrator.collaboration.CollaborationScope;

import java.time.Duration;
import java.util.List;

/**
 * Configuration fixtures for tests that build components without a Spring context.
 */
public final class TestProperties {

    public static final String JWT_SECRET = "test-user-token-secret-0123456789-abcdefghij";
    public static final String SERVICE_TRUST_SECRET = "test-service-trust-secret-0123456789-abcdef";
    public static final String ISSUER = "pm-orchestrator";

    private TestProperties() {
    }

    public static OrchestratorProperties create() {
        return create(Duration.ofSeconds(1), 2, Duration.ofSeconds(5), CollaborationScope.ORGANIZATION);
    }

    public static OrchestratorProperties withScope(CollaborationScope scope) {
        return create(Duration.ofSeconds(1), 2, Duration.ofSeconds(5), scope);
    }

    public static OrchestratorProperties create(Duration backendTimeout, int maxRetries, Duration deadline,
                                                CollaborationScope scope) {
        return new OrchestratorProperties(
                new OrchestratorProperties.Jwt(JWT_SECRET, Duration.ofDays(7), ISSUER),
                new OrchestratorProperties.ServiceTrust(SERVICE_TRUST_SECRET, Duration.ofSeconds(60), ISSUER),
                new OrchestratorProperties.Backends(
                        backend("http://atlas:8000", backendTimeout, maxRetries),
                        backend("http://workpulse:8001", backendTimeout, maxRetries),
                        backend("http://epr:8003", backendTimeout, maxRetries),
                        backend("http://labs:8004/", backendTimeout, maxRetries)),
                new OrchestratorProperties.Aggregation(deadline, Duration.ofMillis(500)),
                new OrchestratorProperties.Collaboration(scope, "Research Collaboration System"),
                new OrchestratorProperties.Gateway(List.of(), 3));
    }

    private static OrchestratorProperties.Backend backend(String url, Duration timeout, int maxRetries) {
        return new OrchestratorProperties.Backend(url, timeout, maxRetries, Duration.ofMillis(10));
    }
}
