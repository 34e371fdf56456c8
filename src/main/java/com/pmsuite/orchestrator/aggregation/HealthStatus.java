package com.pmsuite.orchestrator.aggregation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthStatus {

    HEALTHY,
    /** Responded, but not with a 2xx. */
    DEGRADED,
    /** Timed out or refused the connection. */
    UNREACHABLE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
