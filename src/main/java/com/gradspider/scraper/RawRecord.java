package com.gradspider.scraper;

/**
 * Immutable record of one successfully extracted program.
 * <p>
 * Program name and detail URL are required; every other field may be empty but never null,
 * so sinks can write them without null checks.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public record RawRecord(
    String programName,
    String detailUrl,
    String applyLink,
    String deadline,
    String openDate,
    String faculty,
    String universityCode
) {
    public RawRecord {
        programName = programName == null ? "" : programName;
        detailUrl = detailUrl == null ? "" : detailUrl;
        applyLink = applyLink == null ? "" : applyLink;
        deadline = deadline == null ? "" : deadline;
        openDate = openDate == null ? "" : openDate;
        faculty = faculty == null ? "" : faculty;
        universityCode = universityCode == null ? "" : universityCode;
    }

    public static RawRecord of(String programName, String detailUrl, String universityCode) {
        return new RawRecord(programName, detailUrl, "", "", "", "", universityCode);
    }
}
