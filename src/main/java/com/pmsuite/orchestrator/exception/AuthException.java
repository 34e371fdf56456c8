package com.pmsuite.orchestrator.exception;

import lombok.Getter;

/**
 * Bearer token rejected by the token service.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorType type;

    public AuthException(AuthErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public AuthException(AuthErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public enum AuthErrorType {
        EXPIRED,
        MALFORMED,
        INVALID
    }
}
