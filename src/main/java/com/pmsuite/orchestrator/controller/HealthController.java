package com.pmsuite.orchestrator.controller;

import com.pmsuite.orchestrator.aggregation.AggregateHealthReport;
import com.pmsuite.orchestrator.aggregation.AggregationEngine;
import com.pmsuite.orchestrator.aggregation.ServiceInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Public health endpoints. Always 200 while the orchestrator itself runs;
 * backend problems are reported in the body.
 */
@Tag(name = "Health")
@RestController
public class HealthController {

    private final AggregationEngine aggregationEngine;

    public HealthController(AggregationEngine aggregationEngine) {
        this.aggregationEngine = aggregationEngine;
    }

    @Operation(summary = "Aggregate health of the orchestrator and every backend")
    @GetMapping({"/health", "/api/v1/health"})
    public Mono<AggregateHealthReport> health() {
        return aggregationEngine.health();
    }

    @Operation(summary = "Backends behind the orchestrator with their current status")
    @GetMapping("/api/v1/services")
    public Mono<List<ServiceInfo>> services() {
        return aggregationEngine.services();
    }
}
