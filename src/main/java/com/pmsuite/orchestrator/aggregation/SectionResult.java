package com.pmsuite.orchestrator.aggregation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One dashboard section. A failed section has no data and carries the
 * error code of the branch that produced it.
 */
public record SectionResult(boolean available, JsonNode data, String error) {

    public static SectionResult ok(JsonNode data) {
        return new SectionResult(true, data, null);
    }

    public static SectionResult failed(String error) {
        return new SectionResult(false, null, error);
    }
}
