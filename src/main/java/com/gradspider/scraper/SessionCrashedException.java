package com.gradspider.scraper;

/**
 * The browser session is no longer usable: target closed, browser disconnected, or the site
 * answered with a bot-block page. The session is destroyed on release.
 */
public class SessionCrashedException extends ExtractionException {
    public SessionCrashedException(String message) {
        super(ExtractionErrorKind.SESSION_CRASHED, message);
    }

    public SessionCrashedException(String message, Throwable cause) {
        super(ExtractionErrorKind.SESSION_CRASHED, message, cause);
    }
}
