package com.pmsuite.orchestrator.controller;

import com.pmsuite.orchestrator.aggregation.AggregationEngine;
import com.pmsuite.orchestrator.aggregation.DashboardView;
import com.pmsuite.orchestrator.filter.GlobalAuthFilter;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Tag(name = "Dashboard")
@RestController
public class DashboardController {

    private final AggregationEngine aggregationEngine;

    public DashboardController(AggregationEngine aggregationEngine) {
        this.aggregationEngine = aggregationEngine;
    }

    @Operation(summary = "Projects, activity, performance and labs for the caller in one response")
    @GetMapping("/api/v1/dashboard")
    public Mono<DashboardView> dashboard(
            @RequestAttribute(GlobalAuthFilter.CONTEXT_ATTRIBUTE) OrganizationContext context) {
        return aggregationEngine.dashboard(context);
    }
}
