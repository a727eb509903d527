package com.gradspider.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stores harvested programs in PostgreSQL, one row per {@code (university_code, program_name, detail_url)},
 * the same identity the in-run deduplication uses.
 * Columns follow {@link ProgramFieldRegistry}, the same order the CSV export uses.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class PostgresService implements PostgresServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);

    private static final String TABLE = "programs";
    private static final List<String> IDENTITY_COLUMNS = List.of("university_code", "program_name", "detail_url");
    private static final String IDENTITY = String.join(", ", IDENTITY_COLUMNS);

    private final String url;
    private final String user;
    private final String password;

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Connection parameters for the default database of an embedded instance.
     */
    public static PostgresService forEmbedded(EmbeddedPostgres postgres) {
        return new PostgresService(String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort()),
            "postgres", "postgres");
    }

    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void createTables() throws SQLException {
        String columns = ProgramFieldRegistry.getFields().stream()
            .map(f -> f.column() + " TEXT NOT NULL DEFAULT ''")
            .collect(Collectors.joining(", "));
        String ddl = "CREATE TABLE IF NOT EXISTS " + TABLE + " (" +
                "id SERIAL PRIMARY KEY, " +
                columns + ", " +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now(), " +
                "UNIQUE (" + IDENTITY + ")" +
                ")";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
            logger.info("Ensured {} table exists.", TABLE);
        }
    }

    @Override
    public int upsertPrograms(UniversityProfile profile, List<RawRecord> records) throws SQLException {
        if (profile == null) throw new IllegalArgumentException("University profile cannot be null");
        if (records == null || records.isEmpty()) {
            logger.warn("No programs to store for {}", profile.code());
            return 0;
        }
        List<ProgramField> fields = ProgramFieldRegistry.getFields();
        String cols = fields.stream().map(ProgramField::column).collect(Collectors.joining(", "));
        String params = fields.stream().map(f -> "?").collect(Collectors.joining(", "));
        String updates = fields.stream()
            .map(ProgramField::column)
            .filter(c -> !IDENTITY_COLUMNS.contains(c))
            .map(c -> c + " = EXCLUDED." + c)
            .collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + TABLE + " (" + cols + ") VALUES (" + params + ") " +
                "ON CONFLICT (" + IDENTITY + ") DO UPDATE SET " + updates + ", updated_at = now()";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            conn.setAutoCommit(false);
            try {
                for (RawRecord record : records) {
                    for (int i = 0; i < fields.size(); i++) {
                        ps.setString(i + 1, fields.get(i).valueOf(profile, record));
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
        logger.info("Upserted {} programs for {}.", records.size(), profile.code());
        return records.size();
    }

    @Override
    public int countPrograms(String universityCode) throws SQLException {
        String sql = "SELECT count(*) FROM " + TABLE + " WHERE university_code = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, universityCode);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server, 0 for any free port
     * @return EmbeddedPostgres instance
     * @throws IOException if the server cannot be started
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) throws IOException {
        EmbeddedPostgres.Builder builder = EmbeddedPostgres.builder()
            .setDataDirectory(Paths.get(dataDir))
            .setCleanDataDirectory(false);
        if (port > 0) builder.setPort(port);
        EmbeddedPostgres postgres = builder.start();
        logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, postgres.getPort());
        return postgres;
    }
}
