package com.gradspider.scraper;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    void testSanitizeFilename() {
        assertEquals("HK001 The University_ Hong Kong", Utils.sanitizeFilename("HK001 The University/ Hong Kong"));
        assertEquals("a_b_c_d_e", Utils.sanitizeFilename("a:b?c*d|e"));
        assertEquals("", Utils.sanitizeFilename(null));
    }

    @Test
    void testCleanText() {
        assertEquals("MSc in Finance", Utils.cleanText("  MSc in \n\t Finance "));
        assertEquals("", Utils.cleanText(null));
    }

    @Test
    void testBackoffDelayDoublesUpToCap() {
        assertEquals(100, Utils.backoffDelay(100, 1, 8));
        assertEquals(200, Utils.backoffDelay(100, 2, 8));
        assertEquals(400, Utils.backoffDelay(100, 3, 8));
        assertEquals(800, Utils.backoffDelay(100, 4, 8));
        assertEquals(800, Utils.backoffDelay(100, 40, 8));
        assertEquals(0, Utils.backoffDelay(0, 3, 8));
    }

    @Test
    void testRetrySucceedsAfterFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        int result = Utils.<Integer, IOException>retryWithBackoff(() -> {
            if (calls.incrementAndGet() < 3) throw new IOException("flaky");
            return 42;
        }, 3, 1, e -> true, "test action");
        assertEquals(42, result);
        assertEquals(3, calls.get());
    }

    @Test
    void testRetryGivesUpWithLastFailure() {
        AtomicInteger calls = new AtomicInteger();
        IOException e = assertThrows(IOException.class, () -> Utils.<Integer, IOException>retryWithBackoff(() -> {
            throw new IOException("fail " + calls.incrementAndGet());
        }, 2, 1, x -> true, "fail action"));
        assertEquals("fail 2", e.getMessage());
    }

    @Test
    void testNonRetryableFailureNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(FieldMissingException.class, () -> Utils.<String, ExtractionException>retryWithBackoff(() -> {
            calls.incrementAndGet();
            throw new FieldMissingException("programName", "https://u/p");
        }, 5, 1, x -> x.kind() == ExtractionErrorKind.TIMEOUT, "read title"));
        assertEquals(1, calls.get());
    }

    @Test
    void testRuntimeExceptionPropagatesImmediately() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(IllegalStateException.class, () -> Utils.<String, IOException>retryWithBackoff(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }, 5, 1, x -> true, "buggy action"));
        assertEquals(1, calls.get());
    }
}
