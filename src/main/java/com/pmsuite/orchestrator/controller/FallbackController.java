package com.pmsuite.orchestrator.controller;

import com.pmsuite.orchestrator.proxy.BackendService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fallback Controller
 *
 * Provides fallback responses when a routed backend is unavailable.
 * Used by Circuit Breaker pattern for resilience.
 */
@Slf4j
@RestController
@RequestMapping("/fallback")
public class FallbackController {

    @RequestMapping("/{service}")
    public Mono<ResponseEntity<Map<String, Object>>> serviceFallback(@PathVariable String service) {
        String serviceName = BackendService.fromServiceName(service).serviceName();
        log.warn("Circuit breaker fallback for {}", serviceName);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", HttpStatus.SERVICE_UNAVAILABLE.value());
        body.put("error", "Service Unavailable");
        body.put("code", "SERVICE_UNAVAILABLE");
        body.put("message", capitalize(serviceName) + " service is currently unavailable. Please try again later.");
        body.put("service", serviceName);

        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body));
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
