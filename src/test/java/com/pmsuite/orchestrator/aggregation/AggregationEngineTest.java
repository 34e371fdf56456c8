package com.pmsuite.orchestrator.aggregation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmsuite.orchestrator.collaboration.CollaborationScope;
import com.pmsuite.orchestrator.config.TestProperties;
import com.pmsuite.orchestrator.exception.AggregateUnavailableException;
import com.pmsuite.orchestrator.exception.ProxyException;
import com.pmsuite.orchestrator.proxy.BackendService;
import com.pmsuite.orchestrator.proxy.ProxyResponse;
import com.pmsuite.orchestrator.proxy.ServiceProxy;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.Role;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AggregationEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private static final OrganizationContext MANAGER = new OrganizationContext(
            new Principal("u-1", "org-1", Role.MANAGER), "org-1", Role.MANAGER);
    private static final OrganizationContext MEMBER = new OrganizationContext(
            new Principal("u-2", "org-1", Role.MEMBER), "org-1", Role.MEMBER);

    private ServiceProxy serviceProxy;
    private AggregationEngine engine;
    private Map<String, Mono<ProxyResponse>> responses;

    @BeforeEach
    void setUp() {
        serviceProxy = Mockito.mock(ServiceProxy.class);
        responses = new HashMap<>();
        when(serviceProxy.get(any(BackendService.class), anyString(), any(OrganizationContext.class)))
                .thenAnswer(invocation -> responses.getOrDefault(invocation.<String>getArgument(1),
                        Mono.error(new IllegalStateException("unexpected path " + invocation.getArgument(1)))));

        engine = new AggregationEngine(serviceProxy,
                TestProperties.create(Duration.ofSeconds(1), 0, Duration.ofMillis(300), CollaborationScope.ORGANIZATION),
                new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void respond(BackendService service, String path, String body) {
        responses.put(path, Mono.just(new ProxyResponse(service, 200, body)));
    }

    private void fail(BackendService service, String path, int status) {
        responses.put(path, Mono.error(ProxyException.backendError(service, status, "{\"detail\":\"down\"}")));
    }

    private void respondAllFor(String userId) {
        respond(BackendService.ATLAS, "/api/v1/projects", "[{\"id\":\"p1\"}]");
        respond(BackendService.WORKPULSE, "/api/v1/activity/user/" + userId + "/today", "{\"minutes\":42}");
        respond(BackendService.EPR, "/api/v1/goals/user/" + userId, "[{\"id\":\"g1\"}]");
        respond(BackendService.EPR, "/api/v1/reviews/user/" + userId, "[]");
        respond(BackendService.LABS, "/labs", "[{\"id\":\"lab-1\"}]");
        respond(BackendService.WORKPULSE, "/api/v1/activity/team/org-1", "{\"members\":3}");
    }

    // ==================== DASHBOARD ====================

    @Test
    void dashboard_shouldMergeEverySection() {
        respondAllFor("u-1");

        DashboardView view = engine.dashboard(MANAGER).block();

        assertEquals("p1", view.projects().data().get(0).get("id").asText());
        assertEquals(42, view.activity().data().get("minutes").asInt());
        assertEquals("g1", view.performance().data().get("goals").get(0).get("id").asText());
        assertTrue(view.performance().data().get("reviews").isArray());
        assertEquals("lab-1", view.labs().data().get(0).get("id").asText());
        assertEquals(3, view.teamActivity().data().get("members").asInt());
        assertEquals(Role.MANAGER, view.user().role());
    }

    @Test
    void dashboard_shouldOnlyCallBackendsAsTheCallersOrganization() {
        OrganizationContext otherTenant = new OrganizationContext(
                new Principal("u-7", "org-2", Role.ADMIN), "org-2", Role.ADMIN);
        respondAllFor("u-7");
        respond(BackendService.WORKPULSE, "/api/v1/activity/team/org-2", "{\"members\":1}");

        DashboardView view = engine.dashboard(otherTenant).block();

        ArgumentCaptor<String> paths = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<OrganizationContext> contexts = ArgumentCaptor.forClass(OrganizationContext.class);
        verify(serviceProxy, times(6)).get(any(BackendService.class), paths.capture(), contexts.capture());
        assertTrue(contexts.getAllValues().stream().allMatch(context -> context.organizationId().equals("org-2")));
        assertFalse(paths.getAllValues().contains("/api/v1/activity/team/org-1"));
        assertEquals(1, view.teamActivity().data().get("members").asInt());
    }

    @Test
    void dashboard_shouldDegradeOnlyTheFailingSection() {
        respondAllFor("u-1");
        fail(BackendService.ATLAS, "/api/v1/projects", 500);

        DashboardView view = engine.dashboard(MANAGER).block();

        assertFalse(view.projects().available());
        assertEquals("BACKEND_ERROR", view.projects().error());
        assertTrue(view.activity().available());
        assertTrue(view.performance().available());
        assertTrue(view.labs().available());
    }

    @Test
    void dashboard_shouldFailPerformanceWhenEitherHalfFails() {
        respondAllFor("u-1");
        responses.put("/api/v1/reviews/user/u-1",
                Mono.error(ProxyException.unreachable(BackendService.EPR, new ConnectException("refused"))));

        DashboardView view = engine.dashboard(MANAGER).block();

        assertFalse(view.performance().available());
        assertEquals("UNREACHABLE", view.performance().error());
    }

    @Test
    void dashboard_shouldNotDependOnCompletionOrder() {
        respondAllFor("u-1");
        responses.put("/api/v1/projects", Mono.just(new ProxyResponse(BackendService.ATLAS, 200, "[{\"id\":\"slow\"}]"))
                .delayElement(Duration.ofMillis(120)));
        responses.put("/labs", Mono.just(new ProxyResponse(BackendService.LABS, 200, "[{\"id\":\"medium\"}]"))
                .delayElement(Duration.ofMillis(60)));

        DashboardView view = engine.dashboard(MANAGER).block();

        assertEquals("slow", view.projects().data().get(0).get("id").asText());
        assertEquals("medium", view.labs().data().get(0).get("id").asText());
        assertEquals(42, view.activity().data().get("minutes").asInt());
    }

    @Test
    void dashboard_shouldMarkBranchPastDeadlineAsTimeout() {
        respondAllFor("u-1");
        responses.put("/labs", Mono.never());

        DashboardView view = engine.dashboard(MANAGER).block(Duration.ofSeconds(5));

        assertFalse(view.labs().available());
        assertEquals(AggregationEngine.DEADLINE_EXCEEDED, view.labs().error());
        assertTrue(view.projects().available());
    }

    @Test
    void dashboard_shouldFailWhenEveryCoreSectionFails() {
        fail(BackendService.ATLAS, "/api/v1/projects", 503);
        fail(BackendService.WORKPULSE, "/api/v1/activity/user/u-1/today", 503);
        fail(BackendService.EPR, "/api/v1/goals/user/u-1", 503);
        fail(BackendService.EPR, "/api/v1/reviews/user/u-1", 503);
        fail(BackendService.LABS, "/labs", 503);
        respond(BackendService.WORKPULSE, "/api/v1/activity/team/org-1", "{}");

        assertThrows(AggregateUnavailableException.class, () -> engine.dashboard(MANAGER).block());
    }

    @Test
    void dashboard_shouldOmitTeamActivityForMembers() {
        respondAllFor("u-2");

        DashboardView view = engine.dashboard(MEMBER).block();

        assertNull(view.teamActivity());
        verify(serviceProxy, never()).get(eq(BackendService.WORKPULSE), eq("/api/v1/activity/team/org-1"), any());
    }

    // ==================== HEALTH ====================

    @Test
    void health_shouldReportEveryBackendInFixedOrder() {
        when(serviceProxy.probe(eq(BackendService.ATLAS), eq(AggregationEngine.HEALTH_PATH), any()))
                .thenReturn(Mono.just(new ProxyResponse(BackendService.ATLAS, 200, "{}")));
        when(serviceProxy.probe(eq(BackendService.WORKPULSE), eq(AggregationEngine.HEALTH_PATH), any()))
                .thenReturn(Mono.error(ProxyException.backendError(BackendService.WORKPULSE, 503, "")));
        when(serviceProxy.probe(eq(BackendService.EPR), eq(AggregationEngine.HEALTH_PATH), any()))
                .thenReturn(Mono.error(ProxyException.unreachable(BackendService.EPR, new ConnectException("refused"))));
        when(serviceProxy.probe(eq(BackendService.LABS), eq(AggregationEngine.HEALTH_PATH), any()))
                .thenReturn(Mono.error(ProxyException.timeout(BackendService.LABS, null)));

        AggregateHealthReport report = engine.health().block();

        assertEquals(HealthStatus.HEALTHY, report.orchestrator());
        assertEquals(NOW, report.timestamp());
        assertEquals(List.of("atlas", "workpulse", "epr", "labs"), List.copyOf(report.services().keySet()));
        assertEquals(HealthStatus.HEALTHY, report.services().get("atlas").status());
        assertEquals("http://atlas:8000", report.services().get("atlas").url());
        assertEquals(HealthStatus.DEGRADED, report.services().get("workpulse").status());
        assertEquals("BACKEND_ERROR 503", report.services().get("workpulse").detail());
        assertEquals(HealthStatus.UNREACHABLE, report.services().get("epr").status());
        assertEquals(HealthStatus.UNREACHABLE, report.services().get("labs").status());
        assertEquals("TIMEOUT", report.services().get("labs").detail());
    }

    @Test
    void services_shouldListBackendsWithStatus() {
        when(serviceProxy.probe(any(BackendService.class), eq(AggregationEngine.HEALTH_PATH), any()))
                .thenAnswer(invocation -> Mono.just(new ProxyResponse(invocation.getArgument(0), 200, "{}")));

        List<ServiceInfo> services = engine.services().block();

        assertEquals(4, services.size());
        assertEquals(new ServiceInfo("labs", "http://labs:8004", HealthStatus.HEALTHY), services.get(3));
    }
}
