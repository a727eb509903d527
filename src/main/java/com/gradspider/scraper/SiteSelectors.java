package com.gradspider.scraper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * CSS selectors describing where a university site keeps its program list and detail fields.
 * Only {@code listItem} is mandatory; blank selectors fall back to the defaults in
 * {@link ProgramFieldRegistry} or to a labelled-date search over the page text.
 *
 * @param listItem    links to program detail content on the list page
 * @param nextPage    pagination control on the list page
 * @param detailReady element whose presence means the detail content has rendered
 * @param title       program name on the detail content
 * @param faculty     faculty or study area
 * @param applyLink   element carrying the application URL in {@code href}
 * @param applyPopup  element that opens the application portal in a new window
 * @param deadline    element holding the application deadline text
 * @param openDate    element holding the application opening date text
 * @param maxPages    upper bound on list pages followed through {@code nextPage}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SiteSelectors(
    String listItem,
    String nextPage,
    String detailReady,
    String title,
    String faculty,
    String applyLink,
    String applyPopup,
    String deadline,
    String openDate,
    Integer maxPages
) {
    public static final int DEFAULT_MAX_PAGES = 50;

    public int pageLimit() {
        return maxPages == null || maxPages < 1 ? DEFAULT_MAX_PAGES : maxPages;
    }

    public static boolean isSet(String selector) {
        return selector != null && !selector.isBlank();
    }
}
