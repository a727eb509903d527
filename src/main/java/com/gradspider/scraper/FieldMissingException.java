package com.gradspider.scraper;

/**
 * A required field (program name or detail URL) could not be read from the detail content.
 */
public class FieldMissingException extends ExtractionException {
    private final String field;

    public FieldMissingException(String field, String locator) {
        super(ExtractionErrorKind.FIELD_MISSING, "Required field '" + field + "' missing for " + locator);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
