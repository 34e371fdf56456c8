package com.pmsuite.orchestrator.collaboration;

import com.pmsuite.orchestrator.config.OrchestratorProperties;
import com.pmsuite.orchestrator.exception.AuthorizationException;
import com.pmsuite.orchestrator.exception.InvalidStateException;
import com.pmsuite.orchestrator.exception.NotFoundException;
import com.pmsuite.orchestrator.tenant.OrganizationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Collaboration endpoints over a fresh Labs snapshot per request.
 *
 * Every operation is confined to the caller's organization through the
 * configured {@link CollaborationScope}.
 */
@Slf4j
@Service
public class CollaborationService {

    private final LabsSnapshotReader snapshotReader;
    private final CollaborationScorer scorer;
    private final CollaborationStore store;
    private final CollaborationEmailGenerator emailGenerator;
    private final OrchestratorProperties.Collaboration settings;
    private final Clock clock;

    public CollaborationService(LabsSnapshotReader snapshotReader,
                                CollaborationScorer scorer,
                                CollaborationStore store,
                                CollaborationEmailGenerator emailGenerator,
                                OrchestratorProperties properties,
                                Clock clock) {
        this.snapshotReader = snapshotReader;
        this.scorer = scorer;
        this.store = store;
        this.emailGenerator = emailGenerator;
        this.settings = properties.collaboration();
        this.clock = clock;
    }

    /**
     * Ranked suggestions visible to the caller. Pairs already accepted are
     * reported with status accepted.
     */
    public Mono<List<CollaborationSuggestion>> listSuggestions(OrganizationContext context) {
        return Mono.zip(snapshotReader.read(context), store.findAccepted())
                .map(loaded -> {
                    LabsSnapshot snapshot = loaded.getT1();
                    Set<LabPair> accepted = loaded.getT2();
                    return scorer.suggest(snapshot).stream()
                            .filter(suggestion -> isVisible(suggestion, snapshot, context))
                            .map(suggestion -> accepted.contains(suggestion.pair())
                                    ? suggestion.withStatus(SuggestionStatus.ACCEPTED)
                                    : suggestion)
                            .toList();
                });
    }

    /**
     * Accepted pairs visible to the caller, with their current score.
     * Pairs whose labs no longer exist are left out.
     */
    public Mono<List<CollaborationSuggestion>> listAccepted(OrganizationContext context) {
        return Mono.zip(snapshotReader.read(context), store.findAccepted())
                .map(loaded -> {
                    LabsSnapshot snapshot = loaded.getT1();
                    return loaded.getT2().stream()
                            .filter(pair -> snapshot.findLab(pair.labAId()).isPresent()
                                    && snapshot.findLab(pair.labBId()).isPresent())
                            .map(pair -> scorer.evaluate(snapshot.findLab(pair.labAId()).get(),
                                    snapshot.findLab(pair.labBId()).get(), snapshot))
                            .filter(suggestion -> isVisible(suggestion, snapshot, context))
                            .map(suggestion -> suggestion.withStatus(SuggestionStatus.ACCEPTED))
                            .sorted(CollaborationScorer.RANKING)
                            .toList();
                });
    }

    /**
     * Accepts a pair regardless of its current score. Accepting twice
     * leaves the pair accepted.
     */
    public Mono<CollaborationSuggestion> accept(OrganizationContext context, String labAId, String labBId) {
        return resolvePair(context, labAId, labBId)
                .flatMap(resolved -> store.markAccepted(resolved.pair())
                        .map(newlyAccepted -> {
                            if (newlyAccepted) {
                                log.info("User {} accepted collaboration {}", context.userId(), resolved.pair().key());
                            }
                            return scorer.evaluate(resolved.labA(), resolved.labB(), resolved.snapshot())
                                    .withStatus(SuggestionStatus.ACCEPTED);
                        }));
    }

    public Mono<CollaborationEmail> generateEmail(OrganizationContext context, String labAId, String labBId) {
        return resolvePair(context, labAId, labBId)
                .map(resolved -> {
                    CollaborationSuggestion suggestion =
                            scorer.evaluate(resolved.labA(), resolved.labB(), resolved.snapshot());
                    Lab labA = resolved.snapshot().findLab(suggestion.labAId()).orElseThrow();
                    Lab labB = resolved.snapshot().findLab(suggestion.labBId()).orElseThrow();
                    return emailGenerator.generate(labA, labB, suggestion.rationale(),
                            settings.senderSignature(), clock.instant());
                });
    }

    private Mono<ResolvedPair> resolvePair(OrganizationContext context, String labAId, String labBId) {
        if (labAId.equals(labBId)) {
            return Mono.error(new InvalidStateException("A lab cannot collaborate with itself"));
        }
        LabPair pair = LabPair.of(labAId, labBId);
        return snapshotReader.read(context)
                .map(snapshot -> {
                    Lab labA = snapshot.findLab(pair.labAId())
                            .orElseThrow(() -> new NotFoundException("Lab " + pair.labAId() + " not found"));
                    Lab labB = snapshot.findLab(pair.labBId())
                            .orElseThrow(() -> new NotFoundException("Lab " + pair.labBId() + " not found"));
                    if (!settings.scope().permits(labA, labB, context.organizationId())) {
                        log.warn("User {} denied access to collaboration {} outside organization {}",
                                context.userId(), pair.key(), context.organizationId());
                        throw AuthorizationException.forbidden("Labs are outside your organization's collaboration scope");
                    }
                    return new ResolvedPair(pair, labA, labB, snapshot);
                });
    }

    private boolean isVisible(CollaborationSuggestion suggestion, LabsSnapshot snapshot, OrganizationContext context) {
        Lab labA = snapshot.findLab(suggestion.labAId()).orElseThrow();
        Lab labB = snapshot.findLab(suggestion.labBId()).orElseThrow();
        return settings.scope().permits(labA, labB, context.organizationId());
    }

    private record ResolvedPair(LabPair pair, Lab labA, Lab labB, LabsSnapshot snapshot) {
    }
}
