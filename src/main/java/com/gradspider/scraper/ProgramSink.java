package com.gradspider.scraper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists the accepted records of one run. Records are written as given: empty optional
 * fields are allowed and nothing is deduplicated here.
 */
public interface ProgramSink {
    /**
     * @return where the records were written
     */
    Path write(UniversityProfile profile, List<RawRecord> records) throws IOException;
}
