package com.pmsuite.orchestrator.collaboration;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Renders the outreach email for a lab pair. Pure templating with no side
 * effects.
 */
@Component
public class CollaborationEmailGenerator {

    private static final List<String> BENEFITS = List.of(
            "Shared research resources",
            "Joint publications",
            "Cross-training of researchers",
            "Combined grant opportunities");

    public CollaborationEmail generate(Lab labA, Lab labB, ScoreBreakdown breakdown,
                                       String senderSignature, Instant generatedAt) {
        String pairing = labA.name() + " ↔ " + labB.name();

        StringBuilder body = new StringBuilder()
                .append("Hello,\n\n")
                .append("We identified a strong collaboration opportunity between:\n")
                .append(pairing).append("\n\n")
                .append("Compatibility score: ").append(breakdown.score()).append("/100\n")
                .append(describeDomain(labA, labB, breakdown.domainMatch())).append('\n');

        if (!breakdown.expertiseMatches().isEmpty()) {
            body.append(breakdown.expertiseMatches().size())
                    .append(breakdown.expertiseMatches().size() == 1
                            ? " researcher pairing shares expertise.\n"
                            : " researcher pairings share expertise.\n");
        }

        body.append("\nThis collaboration could lead to:\n");
        BENEFITS.forEach(benefit -> body.append("- ").append(benefit).append('\n'));
        body.append("\nPlease let us know if you are interested.\n\n")
                .append("Regards,\n")
                .append(senderSignature).append('\n');

        return new CollaborationEmail(labA.id(), labB.id(), breakdown.score(),
                "Collaboration Opportunity: " + pairing, body.toString(), generatedAt);
    }

    private static String describeDomain(Lab labA, Lab labB, DomainMatch match) {
        return switch (match) {
            case IDENTICAL -> "Both labs focus on " + labA.focusArea().trim() + ".";
            case SHARED_KEYWORD -> "Related research focus: " + labA.focusArea().trim()
                    + " and " + labB.focusArea().trim() + ".";
            case NONE -> "The labs bring complementary research areas.";
        };
    }
}
