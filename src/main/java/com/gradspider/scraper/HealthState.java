package com.gradspider.scraper;

/**
 * Health of a browser session. Transitions only move forward: HEALTHY, DEGRADED, DEAD.
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    DEAD;

    /**
     * Returns the later of this state and {@code next}, so a session can never recover.
     */
    public HealthState advanceTo(HealthState next) {
        return next.ordinal() > ordinal() ? next : this;
    }

    /**
     * The state one step further along, DEAD staying DEAD.
     */
    public HealthState worsen() {
        return this == HEALTHY ? DEGRADED : DEAD;
    }
}
