package com.gradspider.scraper;

/**
 * Classification of a per-task failure. Recorded with every {@link FailedTask}.
 */
public enum ExtractionErrorKind {
    TIMEOUT,
    FIELD_MISSING,
    SESSION_CRASHED,
    POOL_EXHAUSTED,
    UNEXPECTED,
    CANCELLED
}
