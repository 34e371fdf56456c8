package com.pmsuite.orchestrator.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pmsuite.orchestrator.security.Role;

/**
 * Merged dashboard. Each backend branch owns exactly one slot, so the
 * view is the same whatever order the branches complete in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DashboardView(
        UserSummary user,
        SectionResult projects,
        SectionResult activity,
        SectionResult performance,
        SectionResult labs,
        SectionResult teamActivity) {

    public boolean allCoreSectionsFailed() {
        return !projects.available() && !activity.available() && !performance.available() && !labs.available();
    }

    public record UserSummary(String id, String organizationId, Role role) {
    }
}
