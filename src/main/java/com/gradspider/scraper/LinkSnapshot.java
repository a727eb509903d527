package com.gradspider.scraper;

/**
 * Visible text and raw {@code href} of one element matched on a page.
 */
public record LinkSnapshot(String text, String href) {
    public LinkSnapshot {
        text = text == null ? "" : text.trim();
        href = href == null ? "" : href.trim();
    }
}
