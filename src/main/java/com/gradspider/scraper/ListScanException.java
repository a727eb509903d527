package com.gradspider.scraper;

/**
 * The list-page scan failed, so a run has no tasks to dispatch.
 */
public class ListScanException extends RuntimeException {
    public ListScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
