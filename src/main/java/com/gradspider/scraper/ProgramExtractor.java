package com.gradspider.scraper;

/**
 * Turns one {@link DiscoveryTask} into a {@link RawRecord} using a borrowed session.
 */
@FunctionalInterface
public interface ProgramExtractor {
    /**
     * @throws FieldMissingException if the program name or detail URL cannot be read
     * @throws ExtractionTimeoutException if a bounded wait elapsed
     * @throws SessionCrashedException if the browser went away or the site served a block page
     */
    RawRecord extract(SessionHandle session, DiscoveryTask task) throws ExtractionException;
}
