package com.gradspider.scraper;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One live browser automation session, lent out by {@link SessionPool} to a single Harvester at a time.
 * <p>
 * Every blocking browser call takes an explicit timeout and reports failure as an
 * {@link ExtractionException}: {@link ExtractionTimeoutException} when the wait elapsed,
 * {@link SessionCrashedException} when the browser itself went away. Read operations return an
 * empty string when the element is simply absent.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public interface SessionHandle {

    String id();

    VisibilityMode visibility();

    Instant createdAt();

    HealthState health();

    /**
     * Moves health forward; a request to move backwards is ignored.
     */
    void markHealth(HealthState next);

    /**
     * Number of extraction timeouts since the last successful extraction on this session.
     */
    int consecutiveTimeouts();

    void recordTimeout();

    void recordSuccess();

    void navigate(String url, Duration timeout) throws ExtractionException;

    /**
     * Sets {@code fragment} as the location hash of {@code basePage}, loading the base page first if
     * the session is elsewhere.
     */
    void openHashRoute(String basePage, String fragment, Duration timeout) throws ExtractionException;

    void waitFor(String selector, Duration timeout) throws ExtractionException;

    boolean exists(String selector) throws ExtractionException;

    String readText(String selector) throws ExtractionException;

    String readAttribute(String selector, String attribute) throws ExtractionException;

    List<LinkSnapshot> readLinks(String selector) throws ExtractionException;

    void click(String selector, Duration timeout) throws ExtractionException;

    /**
     * Clicks {@code selector}, waits for the window it opens and returns that window's URL,
     * closing the window again.
     */
    String clickForPopupUrl(String selector, Duration timeout) throws ExtractionException;

    String currentUrl();

    String pageText() throws ExtractionException;

    /**
     * Clears per-task state (extra windows, cookies) before the session goes back to the idle set.
     * @return false if the session could not be reset and should be discarded
     */
    boolean resetState();

    boolean isAlive();

    /**
     * Tears down the underlying native browser resources. Safe to call more than once.
     */
    void close();
}
