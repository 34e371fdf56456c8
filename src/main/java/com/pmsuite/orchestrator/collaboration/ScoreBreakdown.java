package com.pmsuite.orchestrator.collaboration;

import java.util.List;

/**
 * Rationale behind a pair's score.
 *
 * @param rawTotal sum of all bonuses before clamping to the maximum score
 * @param score    the clamped score in [0, 100]
 */
public record ScoreBreakdown(DomainMatch domainMatch, List<ExpertiseMatch> expertiseMatches, int rawTotal, int score) {

    public ScoreBreakdown {
        expertiseMatches = List.copyOf(expertiseMatches);
    }
}
