package com.pmsuite.orchestrator.aggregation;

public record ServiceInfo(String name, String url, HealthStatus status) {
}
