package com.pmsuite.orchestrator.collaboration;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lab Collaboration Scorer
 *
 * Scores every unordered pair of labs:
 * - Base score of 30
 * - +40 for an identical focus area, otherwise +20 for a shared focus keyword
 * - +15 for each researcher pair across the two labs sharing an expertise tag
 * - Clamped to 100
 *
 * Pairs scoring 60 or more are suggested. Stateless and deterministic.
 */
@Component
public class CollaborationScorer {

    // ==================== CONSTANTS ====================

    static final int BASE_SCORE = 30;
    static final int EXPERTISE_PAIR_BONUS = 15;
    static final int MAX_SCORE = 100;
    static final int SUGGESTION_THRESHOLD = 60;

    static final Comparator<CollaborationSuggestion> RANKING =
            Comparator.comparingInt(CollaborationSuggestion::score).reversed()
                    .thenComparing(CollaborationSuggestion::labAId)
                    .thenComparing(CollaborationSuggestion::labBId);

    // ==================== SUGGESTIONS ====================

    /**
     * Suggestions for every pair in the snapshot that reaches the
     * threshold, highest score first, ties broken by lab ids ascending.
     */
    public List<CollaborationSuggestion> suggest(LabsSnapshot snapshot) {
        List<Lab> labs = snapshot.labs();
        List<CollaborationSuggestion> suggestions = new ArrayList<>();

        for (int i = 0; i < labs.size(); i++) {
            for (int j = i + 1; j < labs.size(); j++) {
                Lab first = labs.get(i);
                Lab second = labs.get(j);
                if (first.id().equals(second.id())) {
                    continue;
                }
                CollaborationSuggestion suggestion = evaluate(first, second, snapshot);
                if (suggestion.score() >= SUGGESTION_THRESHOLD) {
                    suggestions.add(suggestion);
                }
            }
        }

        suggestions.sort(RANKING);
        return suggestions;
    }

    /**
     * Scores one pair regardless of the threshold. The labs may be given
     * in either order.
     */
    public CollaborationSuggestion evaluate(Lab first, Lab second, LabsSnapshot snapshot) {
        LabPair pair = LabPair.of(first.id(), second.id());
        Lab labA = pair.labAId().equals(first.id()) ? first : second;
        Lab labB = labA == first ? second : first;

        ScoreBreakdown breakdown = score(labA, snapshot.researchersOf(labA.id()),
                labB, snapshot.researchersOf(labB.id()));

        return new CollaborationSuggestion(labA.id(), labA.name(), labB.id(), labB.name(),
                breakdown.score(), SuggestionStatus.SUGGESTED, breakdown);
    }

    // ==================== SCORING ====================

    public ScoreBreakdown score(Lab labA, List<Researcher> researchersA, Lab labB, List<Researcher> researchersB) {
        DomainMatch domainMatch = matchDomain(labA.focusArea(), labB.focusArea());

        List<ExpertiseMatch> expertiseMatches = new ArrayList<>();
        for (Researcher a : researchersA) {
            for (Researcher b : researchersB) {
                Set<String> shared = new HashSet<>(a.expertise());
                shared.retainAll(b.expertise());
                if (!shared.isEmpty()) {
                    expertiseMatches.add(new ExpertiseMatch(a.id(), b.id(), Set.copyOf(shared)));
                }
            }
        }

        // Expertise bonus is uncapped; only the final total is clamped
        int rawTotal = BASE_SCORE + domainMatch.bonus() + EXPERTISE_PAIR_BONUS * expertiseMatches.size();
        return new ScoreBreakdown(domainMatch, expertiseMatches, rawTotal, Math.min(MAX_SCORE, rawTotal));
    }

    static DomainMatch matchDomain(String focusA, String focusB) {
        if (isBlank(focusA) || isBlank(focusB)) {
            return DomainMatch.NONE;
        }
        String normalizedA = focusA.trim().toLowerCase(Locale.ROOT);
        String normalizedB = focusB.trim().toLowerCase(Locale.ROOT);
        if (normalizedA.equals(normalizedB)) {
            return DomainMatch.IDENTICAL;
        }
        Set<String> keywords = tokens(normalizedA);
        keywords.retainAll(tokens(normalizedB));
        return keywords.isEmpty() ? DomainMatch.NONE : DomainMatch.SHARED_KEYWORD;
    }

    private static Set<String> tokens(String text) {
        return Arrays.stream(text.split("[^\\p{Alnum}]+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(HashSet::new));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
