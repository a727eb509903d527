package com.gradspider.scraper;

import java.sql.SQLException;
import java.util.List;

/**
 * Database operations used to keep harvested programs in PostgreSQL.
 */
public interface PostgresServiceInterface {
    /**
     * Creates the {@code programs} table if it does not already exist.
     */
    void createTables() throws SQLException;

    /**
     * Inserts the records of one university, updating rows that already exist for the same
     * {@code (university_code, detail_url)}.
     * @return number of records written
     */
    int upsertPrograms(UniversityProfile profile, List<RawRecord> records) throws SQLException;

    /**
     * Number of stored programs for a university code.
     */
    int countPrograms(String universityCode) throws SQLException;
}
