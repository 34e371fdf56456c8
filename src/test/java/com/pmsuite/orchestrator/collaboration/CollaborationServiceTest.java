package com.pmsuite.orchestrator.collaboration;

import com.pmsuite.orchestrator.config.TestProperties;
import com.pmsuite.orchestrator.exception.AuthorizationException;
import com.pmsuite.orchestrator.exception.AuthorizationException.AuthzErrorType;
import com.pmsuite.orchestrator.exception.InvalidStateException;
import com.pmsuite.orchestrator.exception.NotFoundException;
import com.pmsuite.orchestrator.security.Principal;
import com.pmsuite.orchestrator.security.Role;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class CollaborationServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private static final OrganizationContext CONTEXT = new OrganizationContext(
            new Principal("u-1", "org-1", Role.MEMBER), "org-1", Role.MEMBER);

    private static final LabsSnapshot SNAPSHOT = new LabsSnapshot(
            List.of(
                    new Lab("lab-a", "org-1", "Vision Lab", "Computer Vision", null),
                    new Lab("lab-b", "org-1", "Perception Lab", "Computer Vision", null),
                    new Lab("lab-c", "org-1", "Soil Lab", "Agronomy", null),
                    new Lab("lab-x", "org-2", "Foreign Vision Lab", "Computer Vision", null)),
            List.of(
                    new Researcher("r-1", "lab-a", "Ana", Set.of("deep learning")),
                    new Researcher("r-2", "lab-b", "Ben", Set.of("Deep Learning", "robotics"))));

    private LabsSnapshotReader snapshotReader;
    private InMemoryStore store;

    @BeforeEach
    void setUp() {
        snapshotReader = Mockito.mock(LabsSnapshotReader.class);
        when(snapshotReader.read(any())).thenReturn(Mono.just(SNAPSHOT));
        store = new InMemoryStore();
    }

    private CollaborationService service(CollaborationScope scope) {
        return new CollaborationService(snapshotReader, new CollaborationScorer(), store,
                new CollaborationEmailGenerator(), TestProperties.withScope(scope), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void listSuggestions_shouldOnlyShowPairsInsideOrganization() {
        List<CollaborationSuggestion> suggestions = service(CollaborationScope.ORGANIZATION).listSuggestions(CONTEXT).block();

        assertEquals(1, suggestions.size());
        assertEquals(new LabPair("lab-a", "lab-b"), suggestions.get(0).pair());
        assertEquals(85, suggestions.get(0).score());
    }

    @Test
    void listSuggestions_shouldIncludeForeignLabsAcrossOrganizations() {
        List<CollaborationSuggestion> suggestions =
                service(CollaborationScope.CROSS_ORGANIZATION).listSuggestions(CONTEXT).block();

        assertEquals(3, suggestions.size());
        assertTrue(suggestions.stream().anyMatch(s -> s.pair().equals(new LabPair("lab-a", "lab-x"))));
    }

    @Test
    void listSuggestions_shouldMarkAcceptedPairs() {
        CollaborationService service = service(CollaborationScope.ORGANIZATION);
        service.accept(CONTEXT, "lab-b", "lab-a").block();

        List<CollaborationSuggestion> suggestions = service.listSuggestions(CONTEXT).block();

        assertEquals(SuggestionStatus.ACCEPTED, suggestions.get(0).status());
    }

    @Test
    void accept_shouldBeIdempotentAndIgnoreThreshold() {
        CollaborationService service = service(CollaborationScope.ORGANIZATION);

        CollaborationSuggestion first = service.accept(CONTEXT, "lab-c", "lab-a").block();
        CollaborationSuggestion second = service.accept(CONTEXT, "lab-a", "lab-c").block();

        assertEquals(first, second);
        assertEquals(SuggestionStatus.ACCEPTED, first.status());
        assertEquals(30, first.score());
        assertEquals(Set.of(new LabPair("lab-a", "lab-c")), store.accepted);

        List<CollaborationSuggestion> accepted = service.listAccepted(CONTEXT).block();
        assertEquals(1, accepted.size());
        assertEquals("lab-a", accepted.get(0).labAId());
    }

    @Test
    void accept_shouldRejectLabOutsideOrganization() {
        assertThrows(AuthorizationException.class,
                () -> service(CollaborationScope.ORGANIZATION).accept(CONTEXT, "lab-a", "lab-x").block());
        assertTrue(store.accepted.isEmpty());
    }

    @Test
    void otherOrganization_shouldNotReachThisOrganizationsLabs() {
        OrganizationContext outsider = new OrganizationContext(
                new Principal("u-9", "org-2", Role.ADMIN), "org-2", Role.ADMIN);
        CollaborationService service = service(CollaborationScope.ORGANIZATION);

        AuthorizationException acceptError = assertThrows(AuthorizationException.class,
                () -> service.accept(outsider, "lab-a", "lab-b").block());
        assertEquals(AuthzErrorType.FORBIDDEN, acceptError.getType());
        assertThrows(AuthorizationException.class, () -> service.generateEmail(outsider, "lab-a", "lab-b").block());
        assertTrue(service.listSuggestions(outsider).block().isEmpty());
        assertTrue(store.accepted.isEmpty());
    }

    @Test
    void accept_shouldAllowForeignLabAcrossOrganizations() {
        CollaborationSuggestion accepted =
                service(CollaborationScope.CROSS_ORGANIZATION).accept(CONTEXT, "lab-x", "lab-a").block();

        assertEquals(new LabPair("lab-a", "lab-x"), accepted.pair());
    }

    @Test
    void accept_shouldRejectPairingLabWithItself() {
        assertThrows(InvalidStateException.class,
                () -> service(CollaborationScope.ORGANIZATION).accept(CONTEXT, "lab-a", "lab-a").block());
    }

    @Test
    void accept_shouldReportMissingLab() {
        assertThrows(NotFoundException.class,
                () -> service(CollaborationScope.ORGANIZATION).accept(CONTEXT, "lab-a", "lab-gone").block());
    }

    @Test
    void listAccepted_shouldDropPairsWhoseLabsAreGone() {
        store.accepted.add(new LabPair("lab-a", "lab-gone"));
        store.accepted.add(new LabPair("lab-a", "lab-b"));

        List<CollaborationSuggestion> accepted = service(CollaborationScope.ORGANIZATION).listAccepted(CONTEXT).block();

        assertEquals(1, accepted.size());
        assertEquals(new LabPair("lab-a", "lab-b"), accepted.get(0).pair());
    }

    @Test
    void generateEmail_shouldDescribeThePair() {
        CollaborationEmail email = service(CollaborationScope.ORGANIZATION).generateEmail(CONTEXT, "lab-b", "lab-a").block();

        assertEquals("Collaboration Opportunity: Vision Lab ↔ Perception Lab", email.subject());
        assertEquals(85, email.score());
        assertEquals(NOW, email.generatedAt());
        assertTrue(email.body().contains("Compatibility score: 85/100"));
        assertTrue(email.body().contains("Both labs focus on Computer Vision."));
        assertTrue(email.body().contains("1 researcher pairing shares expertise."));
        assertTrue(email.body().endsWith("Regards,\nResearch Collaboration System\n"));
    }

    private static final class InMemoryStore implements CollaborationStore {

        private final Set<LabPair> accepted = new TreeSet<>();

        @Override
        public Mono<Boolean> markAccepted(LabPair pair) {
            return Mono.fromCallable(() -> accepted.add(pair));
        }

        @Override
        public Mono<Set<LabPair>> findAccepted() {
            return Mono.fromCallable(() -> Set.copyOf(accepted));
        }
    }
}
