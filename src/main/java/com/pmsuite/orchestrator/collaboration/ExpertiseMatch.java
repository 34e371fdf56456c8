package com.pmsuite.orchestrator.collaboration;

import java.util.Set;

/**
 * A researcher of lab A and a researcher of lab B with at least one
 * expertise tag in common.
 */
public record ExpertiseMatch(String researcherAId, String researcherBId, Set<String> sharedTags) {
}
