package com.pmsuite.orchestrator.collaboration;

/**
 * Which labs a caller may pair up and see suggestions for.
 */
public enum CollaborationScope {

    /** Both labs belong to the caller's active organization. */
    ORGANIZATION,

    /** At least one of the two labs belongs to the caller's active organization. */
    CROSS_ORGANIZATION;

    public boolean permits(Lab labA, Lab labB, String organizationId) {
        boolean ownsA = labA.belongsTo(organizationId);
        boolean ownsB = labB.belongsTo(organizationId);
        return this == ORGANIZATION ? ownsA && ownsB : ownsA || ownsB;
    }
}
