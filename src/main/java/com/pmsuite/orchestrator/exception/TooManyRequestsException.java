package com.pmsuite.orchestrator.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Login blocked after too many failed attempts for one account.
 */
@Getter
public class TooManyRequestsException extends RuntimeException {

    private final Duration retryAfter;

    public TooManyRequestsException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }
}
