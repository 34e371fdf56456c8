package com.pmsuite.orchestrator.aggregation;

import java.time.Instant;
import java.util.Map;

/**
 * Health of the orchestrator and each backend. Backends appear in a fixed
 * order (atlas, workpulse, epr, labs).
 */
public record AggregateHealthReport(HealthStatus orchestrator, Instant timestamp, Map<String, BackendHealth> services) {
}
