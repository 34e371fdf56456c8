package com.pmsuite.orchestrator.security;

/**
 * Claim names shared by user tokens and service-trust credentials.
 */
public final class TokenClaims {

    public static final String ORGANIZATION_ID = "org";
    public static final String ROLE = "role";
    public static final String TOKEN_TYPE = "typ";

    public static final String TYPE_ACCESS = "access";
    public static final String TYPE_SERVICE = "service";

    public static final String SYSTEM_SUBJECT = "orchestrator";

    private TokenClaims() {
    }
}
