package com.gradspider.scraper;

import java.util.List;
import java.util.function.BiFunction;

/**
 * One exported program attribute: its CSV header, its database column, how to read it from a
 * record, and the selectors tried on a detail page when a university does not configure its own.
 *
 * @param fieldName        registry key
 * @param header           CSV column header
 * @param column           database column name
 * @param accessor         value for a record of the given university
 * @param defaultSelectors fallback selectors, most specific first; empty for derived fields
 */
public record ProgramField(
    String fieldName,
    String header,
    String column,
    BiFunction<UniversityProfile, RawRecord, String> accessor,
    List<String> defaultSelectors
) {
    public String valueOf(UniversityProfile profile, RawRecord record) {
        String v = accessor.apply(profile, record);
        return v == null ? "" : v;
    }
}
