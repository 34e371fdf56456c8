package com.pmsuite.orchestrator.collaboration;

import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Persisted collaboration decisions. Acceptance is the only state kept;
 * scores are always recomputed.
 */
public interface CollaborationStore {

    /**
     * Marks a pair accepted. Accepting an already accepted pair is a no-op.
     *
     * @return true if the pair was newly accepted
     */
    Mono<Boolean> markAccepted(LabPair pair);

    Mono<Set<LabPair>> findAccepted();
}
