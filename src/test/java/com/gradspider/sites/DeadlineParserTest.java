package com.gradspider.sites;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DeadlineParserTest {

    @Test
    void testFindDateFormats() {
        assertEquals(Optional.of("Jan 15, 2026"), DeadlineParser.findDate("Applications close on Jan 15, 2026."));
        assertEquals(Optional.of("15th of January 2026"), DeadlineParser.findDate("Closes 15th of January 2026"));
        assertEquals(Optional.of("Sept. 30"), DeadlineParser.findDate("Round 1 ends Sept. 30"));
        assertEquals(Optional.of("2026-01-15"), DeadlineParser.findDate("deadline=2026-01-15"));
        assertEquals(Optional.of("2026年1月15日"), DeadlineParser.findDate("截止日期：2026年1月15日"));
    }

    @Test
    void testNoFalseDates() {
        assertTrue(DeadlineParser.findDate("Intake: May 2025").isEmpty());
        assertTrue(DeadlineParser.findDate("Decision 12 weeks after submission").isEmpty());
        assertTrue(DeadlineParser.findDate("").isEmpty());
        assertTrue(DeadlineParser.findDate(null).isEmpty());
    }

    @Test
    void testLongLinesSkipped() {
        String paragraph = "News: ".repeat(40) + "1 March 2026";
        assertTrue(DeadlineParser.findDate(paragraph).isEmpty());
    }

    @Test
    void testDeadlineFollowsLabel() {
        String page = "Programme Overview\n"
            + "Last updated 2024-01-01\n"
            + "Application Deadline\n"
            + "\n"
            + "31 March 2026\n";
        assertEquals(Optional.of("31 March 2026"), DeadlineParser.findDeadline(page));
    }

    @Test
    void testDateTooFarFromLabelIgnored() {
        String page = "Closing date\n\n\n\n1 April 2026";
        assertTrue(DeadlineParser.findDeadline(page).isEmpty());
    }

    @Test
    void testOpenDate() {
        assertEquals(Optional.of("1 October 2025"),
            DeadlineParser.findOpenDate("Applications open\n1 October 2025\nApplication deadline: 15 Jan 2026"));
        assertEquals(Optional.of("2025年10月1日"), DeadlineParser.findOpenDate("申請開始：2025年10月1日"));
        assertTrue(DeadlineParser.findOpenDate("Deadline: 15 Jan 2026").isEmpty());
    }
}
