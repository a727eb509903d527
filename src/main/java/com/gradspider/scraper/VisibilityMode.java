package com.gradspider.scraper;

import java.util.Locale;

/**
 * Whether a browser session runs with or without a visible window.
 * Some sites only pass bot detection headful, so the mode is chosen per university.
 */
public enum VisibilityMode {
    HEADLESS,
    HEADFUL;

    public boolean headless() {
        return this == HEADLESS;
    }

    public static VisibilityMode parse(String value) {
        if (value == null || value.isBlank()) return HEADLESS;
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "headless", "true" -> HEADLESS;
            case "headful", "headed", "false" -> HEADFUL;
            default -> throw new IllegalArgumentException("Unknown visibility mode: " + value);
        };
    }
}
