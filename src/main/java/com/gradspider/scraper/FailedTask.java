package com.gradspider.scraper;

/**
 * A task that did not produce a record, with the classified reason.
 */
public record FailedTask(DiscoveryTask task, ExtractionErrorKind kind, String reason) {}
