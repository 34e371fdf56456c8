package com.pmsuite.orchestrator.exception;

import com.pmsuite.orchestrator.proxy.BackendService;
import lombok.Getter;

/**
 * Failure of a single outbound backend call.
 *
 * BACKEND_ERROR keeps the backend's status code and body so they can be
 * passed through to the client verbatim.
 */
@Getter
public class ProxyException extends RuntimeException {

    private final ProxyErrorType type;
    private final BackendService backend;
    private final int statusCode;
    private final String responseBody;

    public ProxyException(ProxyErrorType type, BackendService backend, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.backend = backend;
        this.statusCode = 0;
        this.responseBody = null;
    }

    private ProxyException(ProxyErrorType type, BackendService backend, int statusCode, String responseBody) {
        super(backend.serviceName() + " responded with status " + statusCode);
        this.type = type;
        this.backend = backend;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public static ProxyException timeout(BackendService backend, Throwable cause) {
        return new ProxyException(ProxyErrorType.TIMEOUT, backend,
                backend.serviceName() + " did not respond in time", cause);
    }

    public static ProxyException unreachable(BackendService backend, Throwable cause) {
        return new ProxyException(ProxyErrorType.UNREACHABLE, backend,
                backend.serviceName() + " is unreachable", cause);
    }

    public static ProxyException backendError(BackendService backend, int statusCode, String responseBody) {
        return new ProxyException(ProxyErrorType.BACKEND_ERROR, backend, statusCode, responseBody);
    }

    public static ProxyException trustRejected(BackendService backend, int statusCode, String responseBody) {
        return new ProxyException(ProxyErrorType.TRUST_REJECTED, backend, statusCode, responseBody);
    }

    /**
     * Timeouts and connection failures are worth retrying; anything the
     * backend actually answered is not.
     */
    public boolean isTransient() {
        return type == ProxyErrorType.TIMEOUT || type == ProxyErrorType.UNREACHABLE;
    }

    public enum ProxyErrorType {
        TIMEOUT,
        UNREACHABLE,
        BACKEND_ERROR,
        TRUST_REJECTED
    }
}
