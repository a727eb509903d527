package com.gradspider.sites;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds application dates in free page text when a site has no dedicated element for them.
 * <p>
 * Only lines near a label such as "Deadline" or "Application opens" are searched, and lines longer
 * than {@value #MAX_LINE_LENGTH} characters are skipped, which keeps copyright years and news
 * paragraphs out of the result.
 */
public final class DeadlineParser {
    private DeadlineParser() {}

    static final int MAX_LINE_LENGTH = 200;
    // label line plus this many following lines
    static final int LOOKAHEAD_LINES = 2;

    private static final String MONTH = "\\b(?:Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?"
        + "|Aug(?:ust)?|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)\\b\\.?";

    // Jan 15, 2026 | January 15 | 15 Jan 2026 | 15th of January | 2026-01-15 | 2026年1月15日
    private static final List<Pattern> DATE_PATTERNS = List.of(
        Pattern.compile(MONTH + "\\s+\\d{1,2}(?!\\d)(?:st|nd|rd|th)?(?:,?\\s+20\\d{2})?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?<!\\d)\\d{1,2}(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTH + "(?:,?\\s+20\\d{2})?", Pattern.CASE_INSENSITIVE),
        Pattern.compile("20\\d{2}-\\d{2}-\\d{2}"),
        Pattern.compile("20\\d{2}年\\d{1,2}月\\d{1,2}日")
    );

    static final List<String> DEADLINE_LABELS = List.of(
        "deadline", "closing date", "application close", "applications close", "截止"
    );

    static final List<String> OPEN_LABELS = List.of(
        "start date", "opening date", "application open", "applications open", "open date", "開始", "开始"
    );

    /**
     * First date on a line of at most {@value #MAX_LINE_LENGTH} characters.
     */
    public static Optional<String> findDate(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (String line : text.split("\\R")) {
            if (line.length() > MAX_LINE_LENGTH) continue;
            for (Pattern p : DATE_PATTERNS) {
                Matcher m = p.matcher(line);
                if (m.find()) return Optional.of(m.group().trim());
            }
        }
        return Optional.empty();
    }

    public static Optional<String> findDeadline(String pageText) {
        return findLabelled(pageText, DEADLINE_LABELS);
    }

    public static Optional<String> findOpenDate(String pageText) {
        return findLabelled(pageText, OPEN_LABELS);
    }

    /**
     * Searches each line mentioning one of {@code labels} (case-insensitive), and the
     * {@value #LOOKAHEAD_LINES} lines after it, for a date.
     */
    public static Optional<String> findLabelled(String pageText, List<String> labels) {
        if (pageText == null || pageText.isBlank()) return Optional.empty();
        String[] lines = pageText.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String lower = lines[i].toLowerCase(Locale.ROOT);
            if (lower.length() > MAX_LINE_LENGTH || labels.stream().noneMatch(lower::contains)) continue;
            StringBuilder window = new StringBuilder(lines[i]);
            for (int j = i + 1; j <= i + LOOKAHEAD_LINES && j < lines.length; j++) {
                window.append('\n').append(lines[j]);
            }
            Optional<String> date = findDate(window.toString());
            if (date.isPresent()) return date;
        }
        return Optional.empty();
    }
}
