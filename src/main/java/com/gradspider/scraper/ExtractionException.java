package com.gradspider.scraper;

/**
 * Per-task extraction failure. Never escapes the Harvester iteration that produced it.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class ExtractionException extends Exception {
    private final ExtractionErrorKind kind;

    public ExtractionException(ExtractionErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(ExtractionErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ExtractionErrorKind kind() {
        return kind;
    }
}
