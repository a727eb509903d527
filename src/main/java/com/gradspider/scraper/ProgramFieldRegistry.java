package com.gradspider.scraper;

import java.util.ArrayList;
import java.util.List;

/**
 * Central registry of exported program fields, in export order.
 * CSV header, database columns and selector fallbacks all come from here.
 */
public final class ProgramFieldRegistry {
    private ProgramFieldRegistry() {}

    private static final List<ProgramField> FIELDS = List.of(
        new ProgramField("universityCode", "University Code", "university_code",
            (p, r) -> r.universityCode().isEmpty() ? p.code() : r.universityCode(), List.of()),
        new ProgramField("universityName", "University Name", "university_name",
            (p, r) -> p.name(), List.of()),
        new ProgramField("programName", "Program Name", "program_name",
            (p, r) -> r.programName(), List.of("h1", ".programme-title", ".program-title", "h2")),
        new ProgramField("faculty", "Faculty/Study Area", "faculty",
            (p, r) -> r.faculty(), List.of(".faculty", ".study-area", "[class*='faculty']", ".breadcrumb li:nth-last-child(2)")),
        new ProgramField("detailUrl", "Program URL", "detail_url",
            (p, r) -> r.detailUrl(), List.of()),
        new ProgramField("applyLink", "Apply Link", "apply_link",
            (p, r) -> r.applyLink(), List.of("a[href*='apply']", "a:has-text('Apply')", "a:has-text('申請')")),
        new ProgramField("openDate", "Open Date", "open_date",
            (p, r) -> r.openDate(), List.of()),
        new ProgramField("deadline", "Deadline", "deadline",
            (p, r) -> r.deadline(), List.of(".deadline", "[class*='deadline']"))
    );

    public static List<ProgramField> getFields() {
        return FIELDS;
    }

    public static List<String> getFieldNames() {
        List<String> names = new ArrayList<>();
        for (ProgramField f : FIELDS) names.add(f.fieldName());
        return names;
    }

    public static String[] headers() {
        return FIELDS.stream().map(ProgramField::header).toArray(String[]::new);
    }

    /**
     * Returns the field with the given name, or null if not registered.
     */
    public static ProgramField getField(String name) {
        for (ProgramField f : FIELDS) if (f.fieldName().equals(name)) return f;
        return null;
    }

    /**
     * Fallback selectors for {@code name}; empty when the field is unknown or derived.
     */
    public static List<String> defaultSelectors(String name) {
        ProgramField f = getField(name);
        return f == null ? List.of() : f.defaultSelectors();
    }
}
