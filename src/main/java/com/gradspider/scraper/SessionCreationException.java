package com.gradspider.scraper;

/**
 * A {@link SessionFactory} could not launch a browser session.
 */
public class SessionCreationException extends Exception {
    public SessionCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
