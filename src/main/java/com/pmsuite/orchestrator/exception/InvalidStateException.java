package com.pmsuite.orchestrator.exception;

/**
 * Operation not allowed in the entity's current state, e.g. answering an
 * invitation that is already accepted or rejected.
 */
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String message) {
        super(message);
    }
}
