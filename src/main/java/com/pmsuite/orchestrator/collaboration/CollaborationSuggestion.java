package com.pmsuite.orchestrator.collaboration;

/**
 * Scored lab pair. Recomputed from the current labs on every request;
 * only the accepted status is persisted.
 */
public record CollaborationSuggestion(
        String labAId,
        String labAName,
        String labBId,
        String labBName,
        int score,
        SuggestionStatus status,
        ScoreBreakdown rationale) {

    public LabPair pair() {
        return new LabPair(labAId, labBId);
    }

    public CollaborationSuggestion withStatus(SuggestionStatus newStatus) {
        return new CollaborationSuggestion(labAId, labAName, labBId, labBName, score, newStatus, rationale);
    }
}
