package com.pmsuite.orchestrator.collaboration;

/**
 * Focus-area match tier. Tiers are exclusive: a pair earns the bonus of
 * the highest tier it qualifies for and nothing else.
 */
public enum DomainMatch {

    IDENTICAL(40),
    SHARED_KEYWORD(20),
    NONE(0);

    private final int bonus;

    DomainMatch(int bonus) {
        this.bonus = bonus;
    }

    public int bonus() {
        return bonus;
    }
}
