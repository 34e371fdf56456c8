package com.pmsuite.orchestrator.security;

import java.util.List;

/**
 * Headers exchanged between the orchestrator and the backends.
 */
public final class HeaderConstants {

    public static final String SERVICE_TOKEN = "X-Service-Token";
    public static final String SERVICE_NAME = "X-Service-Name";
    public static final String USER_ID = "X-User-Id";
    public static final String ORGANIZATION_ID = "X-Organization-Id";
    public static final String USER_ROLE = "X-User-Role";
    public static final String CORRELATION_ID = "X-Correlation-Id";
    public static final String AUTH_ERROR = "X-Auth-Error";

    public static final String ORCHESTRATOR_SERVICE_NAME = "orchestrator";

    /**
     * Headers only the orchestrator may set. Client-supplied copies are
     * stripped before anything is forwarded.
     */
    public static final List<String> TRUSTED_HEADERS = List.of(
            SERVICE_TOKEN, SERVICE_NAME, USER_ID, ORGANIZATION_ID, USER_ROLE);

    private HeaderConstants() {
    }
}
