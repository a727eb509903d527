package com.gradspider.scraper;

import java.util.Objects;

/**
 * Immutable record of one program discovered on a list page, awaiting detail extraction.
 *
 * @param locator      URL, hash-route fragment or click-target selector, depending on {@code kind}
 * @param kind         how the locator is resolved by the extractor
 * @param sourcePage   list page the task was discovered on
 * @param displayTitle title already visible on the list page, may be empty
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public record DiscoveryTask(String locator, LocatorKind kind, String sourcePage, String displayTitle) {

    public DiscoveryTask {
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(kind, "kind");
        sourcePage = sourcePage == null ? "" : sourcePage;
        displayTitle = displayTitle == null ? "" : displayTitle;
    }

    /**
     * Shorthand for a task pointing straight at a detail-page URL.
     */
    public static DiscoveryTask ofUrl(String url, String displayTitle) {
        return new DiscoveryTask(url, LocatorKind.URL, "", displayTitle);
    }
}
