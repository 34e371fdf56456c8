package com.pmsuite.orchestrator.exception;

import lombok.Getter;

/**
 * Authenticated caller lacks the scope or role for the request.
 */
@Getter
public class AuthorizationException extends RuntimeException {

    private final AuthzErrorType type;

    public AuthorizationException(AuthzErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public static AuthorizationException forbidden(String message) {
        return new AuthorizationException(AuthzErrorType.FORBIDDEN, message);
    }

    public static AuthorizationException noActiveOrganization(String message) {
        return new AuthorizationException(AuthzErrorType.NO_ACTIVE_ORGANIZATION, message);
    }

    public enum AuthzErrorType {
        FORBIDDEN,
        NO_ACTIVE_ORGANIZATION
    }
}
