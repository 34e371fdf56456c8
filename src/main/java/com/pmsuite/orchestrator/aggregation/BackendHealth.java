package com.pmsuite.orchestrator.aggregation;

public record BackendHealth(HealthStatus status, String url, long latencyMs, String detail) {
}
