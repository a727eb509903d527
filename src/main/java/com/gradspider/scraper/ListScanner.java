package com.gradspider.scraper;

import java.util.List;

/**
 * Reads a university's program list and turns each entry into a {@link DiscoveryTask}.
 */
@FunctionalInterface
public interface ListScanner {
    /**
     * @param session borrowed session, driven only by the caller for the duration of the scan
     * @param profile university whose list page is scanned
     * @return tasks in list order, without duplicate locators
     * @throws ExtractionException if the list page could not be loaded or read
     */
    List<DiscoveryTask> scan(SessionHandle session, UniversityProfile profile) throws ExtractionException;
}
