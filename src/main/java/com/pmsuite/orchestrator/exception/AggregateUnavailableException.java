package com.pmsuite.orchestrator.exception;

/**
 * Every branch of a composite request failed.
 */
public class AggregateUnavailableException extends RuntimeException {

    public AggregateUnavailableException(String message) {
        super(message);
    }
}
