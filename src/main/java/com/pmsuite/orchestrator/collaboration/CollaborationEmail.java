package com.pmsuite.orchestrator.collaboration;

import java.time.Instant;

public record CollaborationEmail(
        String labAId,
        String labBId,
        int score,
        String subject,
        String body,
        Instant generatedAt) {
}
