package com.gradspider.scraper;

/**
 * Thrown by {@link SessionPool#acquire} when no session became available within the timeout.
 * Transient: callers retry with backoff.
 */
public class PoolExhaustedException extends Exception {
    public PoolExhaustedException(String message) {
        super(message);
    }
}
