package com.gradspider.scraper;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {

    private static final UniversityProfile HKU = new UniversityProfile("hku", "HK001", "The University of Hong Kong",
        "香港大學", null, "https://portal.hku.hk/list", null, null, null, LocatorKind.URL,
        new SiteSelectors("a.p", null, null, null, null, null, null, null, null, null));

    @Test
    void testWritesHeaderAndRows(@TempDir Path dir) throws Exception {
        RawRecord record = new RawRecord("Master of Finance, Banking", "https://portal.hku.hk/p/1",
            "https://apply.hku.hk", "Round 1: 1 Dec 2025\nRound 2: 15 Jan 2026", "", "Business School", "HK001");

        Path file = new CsvService(dir).write(HKU, List.of(record));
        assertEquals(dir.resolve("HK001 The University of Hong Kong.csv"), file);

        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8); CSVReader reader = new CSVReader(in)) {
            rows = reader.readAll();
        }
        assertEquals(2, rows.size());
        assertArrayEquals(ProgramFieldRegistry.headers(), rows.get(0));

        List<String> header = List.of(rows.get(0));
        String[] row = rows.get(1);
        assertEquals("HK001", row[header.indexOf("University Code")]);
        assertEquals("The University of Hong Kong", row[header.indexOf("University Name")]);
        assertEquals("Master of Finance, Banking", row[header.indexOf("Program Name")]);
        assertEquals("Round 1: 1 Dec 2025 Round 2: 15 Jan 2026", row[header.indexOf("Deadline")]);
        assertEquals("", row[header.indexOf("Open Date")]);
    }

    @Test
    void testEmptyRunWritesHeaderOnly(@TempDir Path dir) throws Exception {
        Path file = new CsvService(dir.resolve("nested")).write(HKU, List.of());
        assertEquals(1, Files.readAllLines(file, StandardCharsets.UTF_8).size());
    }

    @Test
    void testRewriteReplacesEarlierFile(@TempDir Path dir) throws Exception {
        CsvService csv = new CsvService(dir);
        csv.write(HKU, List.of(RawRecord.of("A", "https://u/a", "HK001"), RawRecord.of("B", "https://u/b", "HK001")));
        Path file = csv.write(HKU, List.of(RawRecord.of("C", "https://u/c", "HK001")));
        assertEquals(2, Files.readAllLines(file, StandardCharsets.UTF_8).size());
    }

    @Test
    void testNullArgumentsRejected(@TempDir Path dir) {
        CsvService csv = new CsvService(dir);
        assertThrows(IllegalArgumentException.class, () -> csv.write(HKU, null));
        assertThrows(IllegalArgumentException.class, () -> csv.write(null, List.of()));
    }

    @Test
    void testFileNameSanitized() {
        UniversityProfile odd = new UniversityProfile("x", "X1", "Arts/Science: Institute", null, null,
            "https://x.example", null, null, null, null, HKU.selectors());
        assertEquals("X1 Arts_Science_ Institute.csv", CsvService.fileNameFor(odd));
    }
}
