package com.gradspider.scraper;

/**
 * What a Harvester tells the pool about a session it is handing back.
 */
public enum ReleaseOutcome {
    /** Session behaved; return it unchanged. */
    OK,
    /** Session misbehaved but may still be usable; worsen its health by one step. */
    DEGRADED,
    /** Session is unusable (crash, bot block); destroy it and free the slot. */
    DEAD
}
