package com.gradspider.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @Test
    void testParseKeyAndFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[]{"HKU", "--headful", "--workers", "3", "--db"});
        assertEquals("hku", options.key());
        assertTrue(options.headful());
        assertEquals(3, options.workers());
        assertTrue(options.db());
    }

    @Test
    void testParseNoArguments() {
        Main.CliOptions options = Main.CliOptions.parse(new String[0]);
        assertNull(options.key());
        assertFalse(options.headful());
        assertNull(options.workers());
        assertFalse(options.db());
    }

    @Test
    void testParseRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"hku", "--fast"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"hku", "cuhk"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"hku", "--workers"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"hku", "--workers", "many"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"hku", "--workers", "0"}));
    }

    @Test
    void testRunListsUniversitiesWithoutKey() {
        assertEquals(Main.EXIT_OK, Main.run(new String[0]));
    }

    @Test
    void testRunRejectsUnknownUniversity() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"nowhere"}));
    }

    @Test
    void testRunRejectsBadOption() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"hku", "--workers", "-2"}));
    }

    @Test
    void testCoordinatorUsesProfileScopedSettings() {
        HarvestSettings global = new HarvestSettings(2, Duration.ofSeconds(30), VisibilityMode.HEADLESS,
            Duration.ofSeconds(5), 3, Duration.ofMillis(100), 24, false,
            Duration.ofSeconds(10), 3, "output");
        UniversityProfile profile = new UniversityProfile("slow", "X001", "Slow University", "", null,
            "https://slow.example/list", VisibilityMode.HEADFUL, 5, 90, LocatorKind.URL,
            new SiteSelectors("a.programme", null, null, null, null, null, null, null, null, null));

        HarvestSettings used = Main.coordinatorFor(global, profile).settings();

        assertEquals(global.forProfile(profile), used);
        assertEquals(5, used.poolCapacity());
        assertEquals(Duration.ofSeconds(90), used.operationTimeout());
        assertEquals(VisibilityMode.HEADFUL, used.visibility());
    }
}
