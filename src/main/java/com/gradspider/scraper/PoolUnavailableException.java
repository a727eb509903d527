package com.gradspider.scraper;

/**
 * The pool cannot provide sessions at all, either because session creation failed repeatedly
 * (browser binary missing, sandbox refused) or because the pool is draining. Fatal for the run.
 */
public class PoolUnavailableException extends RuntimeException {
    public PoolUnavailableException(String message) {
        super(message);
    }

    public PoolUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
