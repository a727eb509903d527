package com.gradspider.scraper;

import com.microsoft.playwright.TimeoutError;

import java.util.List;
import java.util.Locale;

/**
 * Maps failures raised while driving a session to an {@link ExtractionErrorKind}, and a kind plus the
 * session's history to the {@link ReleaseOutcome} the pool should apply.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public final class ErrorClassifier {
    private ErrorClassifier() {}

    // Substrings Playwright uses when the page, context or browser process is gone
    private static final List<String> CRASH_MARKERS = List.of(
        "target closed",
        "target page, context or browser has been closed",
        "browser has been closed",
        "browser has disconnected",
        "browser closed",
        "page crashed",
        "connection closed",
        "session closed"
    );

    private static final List<String> BLOCK_MARKERS = List.of(
        "captcha",
        "are you a robot",
        "unusual traffic",
        "access denied",
        "verify you are human",
        "request blocked"
    );

    /**
     * Classifies {@code t}, walking its cause chain.
     */
    public static ExtractionErrorKind classify(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof ExtractionException ee) return ee.kind();
            if (cur instanceof InterruptedException) return ExtractionErrorKind.CANCELLED;
            if (cur instanceof TimeoutError || cur instanceof java.util.concurrent.TimeoutException) {
                return ExtractionErrorKind.TIMEOUT;
            }
            String msg = cur.getMessage() == null ? "" : cur.getMessage().toLowerCase(Locale.ROOT);
            for (String marker : CRASH_MARKERS) {
                if (msg.contains(marker)) return ExtractionErrorKind.SESSION_CRASHED;
            }
            if (msg.contains("timeout") && msg.contains("exceeded")) return ExtractionErrorKind.TIMEOUT;
        }
        return ExtractionErrorKind.UNEXPECTED;
    }

    /**
     * Wraps a raw browser failure in the matching {@link ExtractionException} subtype.
     * @param t failure thrown by the automation library
     * @param action short description of what was being attempted, for the message
     */
    public static ExtractionException toExtractionException(Throwable t, String action) {
        if (t instanceof ExtractionException ee) return ee;
        String message = action + " failed: " + firstLine(t.getMessage());
        return switch (classify(t)) {
            case TIMEOUT -> new ExtractionTimeoutException(message, t);
            case SESSION_CRASHED -> new SessionCrashedException(message, t);
            case CANCELLED -> new ExtractionException(ExtractionErrorKind.CANCELLED, message, t);
            default -> new ExtractionException(ExtractionErrorKind.UNEXPECTED, message, t);
        };
    }

    /**
     * True when page text looks like a bot-detection interstitial rather than content.
     */
    public static boolean looksBlocked(String pageText) {
        if (pageText == null || pageText.isBlank()) return false;
        String lower = pageText.toLowerCase(Locale.ROOT);
        for (String marker : BLOCK_MARKERS) {
            if (lower.contains(marker)) return true;
        }
        return false;
    }

    /**
     * Decides how the pool should treat a session after a failed task. A single timeout leaves the
     * session alone; a repeated one degrades it. Crashes kill it. Missing fields say nothing about
     * the session.
     */
    public static ReleaseOutcome outcomeFor(ExtractionErrorKind kind, SessionHandle session) {
        return switch (kind) {
            case SESSION_CRASHED -> ReleaseOutcome.DEAD;
            case TIMEOUT -> session.consecutiveTimeouts() >= 2 ? ReleaseOutcome.DEGRADED : ReleaseOutcome.OK;
            default -> ReleaseOutcome.OK;
        };
    }

    private static String firstLine(String s) {
        if (s == null) return "";
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }
}
