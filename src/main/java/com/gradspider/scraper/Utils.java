package com.gradspider.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Utility class for common helper methods used in scraping and file operations.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * An action that may fail with a checked exception of type {@code E}.
     */
    @FunctionalInterface
    public interface Attempt<T, E extends Exception> {
        T run() throws E;
    }

    /**
     * Sanitizes a filename by replacing each special character with an underscore.
     * Spaces are kept, so {@code "HK001 The University of Hong Kong"} stays readable.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\\\r\\n\\t]", "_").trim();
    }

    /**
     * Collapses whitespace runs (including non-breaking spaces) to one space and trims.
     */
    public static String cleanText(String s) {
        return s == null ? "" : s.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    /**
     * Exponential backoff: {@code base * 2^(attempt-1)}, capped at {@code base * maxMultiplier}.
     * @param attempt 1-based attempt number that just failed
     */
    public static long backoffDelay(long baseMillis, int attempt, int maxMultiplier) {
        if (baseMillis <= 0 || attempt < 1) return 0L;
        long multiplier = 1L << Math.min(attempt - 1, 30);
        return baseMillis * Math.min(multiplier, maxMultiplier);
    }

    /**
     * Runs {@code action} up to {@code maxAttempts} times with exponential backoff between attempts.
     * @param retryable decides whether a failure is worth another attempt
     * @return result of the first successful attempt
     * @throws E the last failure, or the first one {@code retryable} rejects
     * @throws InterruptedException if interrupted while backing off
     */
    public static <T, E extends Exception> T retryWithBackoff(Attempt<T, E> action, int maxAttempts, long baseDelayMillis,
                                                               Predicate<? super E> retryable, String actionDesc)
        throws E, InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.run();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                @SuppressWarnings("unchecked")
                E failure = (E) e;
                if (attempt >= maxAttempts || !retryable.test(failure)) {
                    if (attempt > 1) logger.error("Giving up on {} after {} attempts.", actionDesc, attempt);
                    throw failure;
                }
                long delay = backoffDelay(baseDelayMillis, attempt, 8);
                logger.warn("Failed {} (attempt {}): {}. Retrying in {} ms.", actionDesc, attempt, e.getMessage(), delay);
                Thread.sleep(delay);
            }
        }
    }
}
