package com.pmsuite.orchestrator.collaboration;

import java.util.Objects;

/**
 * Lab as reported by the Labs backend.
 *
 * @param focusArea free-text research domain, may be null
 */
public record Lab(String id, String organizationId, String name, String focusArea, String description) {

    public Lab {
        Objects.requireNonNull(id, "id");
    }

    public boolean belongsTo(String organizationId) {
        return this.organizationId != null && this.organizationId.equals(organizationId);
    }
}
