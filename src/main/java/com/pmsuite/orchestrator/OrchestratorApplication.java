package com.pmsuite.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * PM Suite Orchestrator Application
 *
 * Single entry point for the project-management suite's backends.
 * Handles:
 * - Token issuance and validation, tenant scope resolution
 * - Service trust propagation to Atlas, WorkPulse, EPR and Labs
 * - Dashboard and health aggregation under partial failure
 * - Lab collaboration scoring
 * - Cross-cutting concerns (CORS, logging, rate limiting, circuit breaking)
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
