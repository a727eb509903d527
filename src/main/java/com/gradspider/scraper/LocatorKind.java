package com.gradspider.scraper;

/**
 * How a {@link DiscoveryTask#locator()} reaches the detail content of a program.
 */
public enum LocatorKind {
    /** An absolute detail-page URL. */
    URL,
    /** A fragment such as {@code #/programme/42} applied to the task's source page. */
    HASH_ROUTE,
    /** A selector on the source page that reveals the detail content when clicked (modal, accordion). */
    CLICK_TARGET
}
