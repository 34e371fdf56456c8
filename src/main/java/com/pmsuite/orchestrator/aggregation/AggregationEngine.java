package com.pmsuite.orchestrator.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pmsuite.orchestrator.config.OrchestratorProperties;
import com.pmsuite.orchestrator.exception.AggregateUnavailableException;
import com.pmsuite.orchestrator.exception.ProxyException;
import com.pmsuite.orchestrator.proxy.BackendService;
import com.pmsuite.orchestrator.proxy.ProxyResponse;
import com.pmsuite.orchestrator.proxy.ServiceProxy;
import com.pmsuite.orchestrator.security.Role;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/*
 * ============================================================================
 * AGGREGATION ENGINE - CODE FLOW
 * ============================================================================
 *
 *   GET /dashboard
 *         │
 *         ▼
 *   ┌──────────┬──────────┬─────────────┬──────────┬──────────────┐
 *   │ projects │ activity │ performance │  labs    │ teamActivity │
 *   │ (atlas)  │(workpulse│   (epr)     │ (labs)   │ (workpulse,  │
 *   │          │  today)  │goals+reviews│          │ manager+)    │
 *   └──────────┴──────────┴─────────────┴──────────┴──────────────┘
 *         │  all branches subscribed at once, each bounded by
 *         │  its own proxy timeout AND the aggregate deadline
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ Branch failed?                      │
 *   │  → SectionResult.failed(errorCode)  │
 *   │ Branch past deadline?               │
 *   │  → cancelled, marked TIMEOUT        │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ All four core sections failed?      │
 *   │  YES → AggregateUnavailable         │
 *   │  NO  → DashboardView                │
 *   └─────────────────────────────────────┘
 *
 * ============================================================================
 */

/**
 * Aggregation Engine
 *
 * Fans one client request out to the backends through the service proxy
 * and merges the answers. A failing backend only ever costs its own
 * section; the request as a whole fails only when nothing succeeded.
 */
@Slf4j
@Component
public class AggregationEngine {

    static final String HEALTH_PATH = "/health";
    static final String DEADLINE_EXCEEDED = "TIMEOUT";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    // Placeholder for a section the caller's role does not entitle them to
    private static final SectionResult NOT_REQUESTED = SectionResult.failed(null);

    private final ServiceProxy serviceProxy;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AggregationEngine(ServiceProxy serviceProxy,
                             OrchestratorProperties properties,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.serviceProxy = serviceProxy;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== HEALTH ====================

    /**
     * Never fails: an unhealthy backend is reported, not raised.
     */
    public Mono<AggregateHealthReport> health() {
        return Flux.fromArray(BackendService.values())
                .flatMapSequential(this::probe)
                .collectList()
                .map(entries -> {
                    Map<String, BackendHealth> services = new LinkedHashMap<>();
                    for (int i = 0; i < entries.size(); i++) {
                        services.put(BackendService.values()[i].serviceName(), entries.get(i));
                    }
                    return new AggregateHealthReport(HealthStatus.HEALTHY, clock.instant(), services);
                });
    }

    public Mono<List<ServiceInfo>> services() {
        return health().map(report -> report.services().entrySet().stream()
                .map(entry -> new ServiceInfo(entry.getKey(), entry.getValue().url(), entry.getValue().status()))
                .toList());
    }

    private Mono<BackendHealth> probe(BackendService service) {
        String url = properties.backends().get(service).baseUrl();
        Duration timeout = properties.aggregation().healthTimeout();

        return Mono.defer(() -> {
            long start = System.nanoTime();
            return serviceProxy.probe(service, HEALTH_PATH, timeout)
                    .map(response -> new BackendHealth(HealthStatus.HEALTHY, url, elapsedMillis(start), null))
                    .onErrorResume(e -> Mono.just(unhealthy(service, url, elapsedMillis(start), e)));
        });
    }

    private BackendHealth unhealthy(BackendService service, String url, long latencyMs, Throwable e) {
        if (e instanceof ProxyException proxyException) {
            HealthStatus status = proxyException.isTransient() ? HealthStatus.UNREACHABLE : HealthStatus.DEGRADED;
            String detail = proxyException.isTransient()
                    ? proxyException.getType().name()
                    : proxyException.getType().name() + " " + proxyException.getStatusCode();
            log.warn("Backend {} is {}: {}", service.serviceName(), status.value(), detail);
            return new BackendHealth(status, url, latencyMs, detail);
        }
        log.error("Health probe for {} failed unexpectedly", service.serviceName(), e);
        return new BackendHealth(HealthStatus.UNREACHABLE, url, latencyMs, INTERNAL_ERROR);
    }

    // ==================== DASHBOARD ====================

    public Mono<DashboardView> dashboard(OrganizationContext context) {
        String userId = context.userId();
        String organizationId = context.organizationId();

        Mono<SectionResult> projects = section("projects",
                json(serviceProxy.get(BackendService.ATLAS, "/api/v1/projects", context)));
        Mono<SectionResult> activity = section("activity",
                json(serviceProxy.get(BackendService.WORKPULSE, "/api/v1/activity/user/" + userId + "/today", context)));
        Mono<SectionResult> performance = section("performance", Mono.zip(
                json(serviceProxy.get(BackendService.EPR, "/api/v1/goals/user/" + userId, context)),
                json(serviceProxy.get(BackendService.EPR, "/api/v1/reviews/user/" + userId, context)))
                .map(goalsAndReviews -> {
                    ObjectNode node = objectMapper.createObjectNode();
                    node.set("goals", goalsAndReviews.getT1());
                    node.set("reviews", goalsAndReviews.getT2());
                    return (JsonNode) node;
                }));
        Mono<SectionResult> labs = section("labs",
                json(serviceProxy.get(BackendService.LABS, "/labs", context)));
        Mono<SectionResult> teamActivity = context.role().satisfies(Role.MANAGER)
                ? section("teamActivity",
                        json(serviceProxy.get(BackendService.WORKPULSE, "/api/v1/activity/team/" + organizationId, context)))
                : Mono.just(NOT_REQUESTED);

        return Mono.zip(projects, activity, performance, labs, teamActivity)
                .flatMap(sections -> {
                    DashboardView view = new DashboardView(
                            new DashboardView.UserSummary(userId, organizationId, context.role()),
                            sections.getT1(),
                            sections.getT2(),
                            sections.getT3(),
                            sections.getT4(),
                            sections.getT5() == NOT_REQUESTED ? null : sections.getT5());
                    if (view.allCoreSectionsFailed()) {
                        log.error("Dashboard unavailable for user {}: every backend section failed", userId);
                        return Mono.<DashboardView>error(new AggregateUnavailableException(
                                "Dashboard is unavailable: all backend services failed"));
                    }
                    return Mono.just(view);
                });
    }

    /**
     * One fan-out branch. The aggregate deadline applies to this branch
     * alone; a branch still running at the deadline is cancelled and its
     * late result never arrives.
     */
    private Mono<SectionResult> section(String name, Mono<JsonNode> call) {
        return call
                .timeout(properties.aggregation().deadline())
                .map(SectionResult::ok)
                .onErrorResume(e -> {
                    String error = errorCode(e);
                    log.warn("Dashboard section {} degraded: {}", name, error);
                    return Mono.just(SectionResult.failed(error));
                });
    }

    private Mono<JsonNode> json(Mono<ProxyResponse> response) {
        return response.map(r -> r.bodyAsJson(objectMapper));
    }

    private static String errorCode(Throwable e) {
        if (e instanceof ProxyException proxyException) {
            return proxyException.getType().name();
        }
        if (e instanceof TimeoutException) {
            return DEADLINE_EXCEEDED;
        }
        return INTERNAL_ERROR;
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
