package com.gradspider.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Writes a run's programs to {@code <outputDir>/<code> <name>.csv} using OpenCSV, one row per record,
 * columns in {@link ProgramFieldRegistry} order.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class CsvService implements ProgramSink {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    private final Path outputDir;

    public CsvService(String outputDir) {
        this(Paths.get(outputDir == null || outputDir.isBlank() ? "output" : outputDir));
    }

    public CsvService(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Writes {@code records} for {@code profile}, replacing any earlier file for the same university.
     * @return the written file
     * @throws IOException if the directory or file cannot be written
     */
    @Override
    public Path write(UniversityProfile profile, List<RawRecord> records) throws IOException {
        if (profile == null) throw new IllegalArgumentException("University profile cannot be null");
        if (records == null) {
            logger.warn("Attempted to write null record list for {}", profile.code());
            throw new IllegalArgumentException("Record list cannot be null");
        }
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(fileNameFor(profile));
        List<ProgramField> fields = ProgramFieldRegistry.getFields();
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(ProgramFieldRegistry.headers());
            for (RawRecord record : records) {
                String[] row = new String[fields.size()];
                for (int i = 0; i < row.length; i++) {
                    row[i] = safe(fields.get(i).valueOf(profile, record));
                }
                writer.writeNext(row);
            }
        }
        logger.info("Wrote {} programs to CSV file: {}", records.size(), file);
        return file;
    }

    static String fileNameFor(UniversityProfile profile) {
        return Utils.sanitizeFilename(profile.code() + " " + profile.name()) + ".csv";
    }

    /**
     * Collapses line breaks into a single space and trims, so every record stays on one line.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
