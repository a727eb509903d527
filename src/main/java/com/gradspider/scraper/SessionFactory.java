package com.gradspider.scraper;

/**
 * Launches new browser sessions for the pool.
 */
@FunctionalInterface
public interface SessionFactory {
    SessionHandle create(String id, VisibilityMode visibility) throws SessionCreationException;
}
