package com.gradspider.scraper;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity key of a {@link RawRecord}: normalized title and normalized URL joined by {@code |}.
 * Recomputed from the record whenever needed; never stored on its own.
 */
public record Fingerprint(String value) {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public static Fingerprint of(RawRecord record) {
        return new Fingerprint(normalize(record.programName()) + "|" + normalize(record.detailUrl()));
    }

    /**
     * Collapses runs of Unicode whitespace (no-break and ideographic spaces included) to a single
     * space, trims and case-folds.
     */
    public static String normalize(String s) {
        if (s == null) return "";
        return WHITESPACE.matcher(s).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }
}
