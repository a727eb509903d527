package com.gradspider.scraper;

/**
 * Navigation or an element wait did not finish within the per-operation timeout.
 */
public class ExtractionTimeoutException extends ExtractionException {
    public ExtractionTimeoutException(String message) {
        super(ExtractionErrorKind.TIMEOUT, message);
    }

    public ExtractionTimeoutException(String message, Throwable cause) {
        super(ExtractionErrorKind.TIMEOUT, message, cause);
    }
}
