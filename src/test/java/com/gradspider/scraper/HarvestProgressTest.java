package com.gradspider.scraper;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class HarvestProgressTest {

    @Test
    void testReportsEveryIntervalAndAtTheEnd() {
        HarvestProgress progress = new HarvestProgress("hku", 5, 2);
        progress.taskSucceeded();
        assertEquals(0, progress.reportCount());
        progress.taskFailed();
        assertEquals(1, progress.reportCount());
        progress.taskSucceeded();
        progress.taskSucceeded();
        assertEquals(2, progress.reportCount());
        progress.taskSucceeded();
        assertEquals(3, progress.reportCount(), "the last task is always reported");

        assertEquals(4, progress.succeeded());
        assertEquals(1, progress.failed());
        assertEquals(5, progress.completed());
        assertEquals(0, progress.remaining());
    }

    @Test
    void testDescribeShowsCountsAndElapsedTime() {
        HarvestProgress progress = new HarvestProgress("hku", 4, 1);
        progress.taskSucceeded();
        progress.taskFailed();
        String line = progress.describe();
        assertTrue(line.startsWith("hku: 2/4 done (1 ok, 1 failed), 2 remaining, "), line);
        assertTrue(line.endsWith("s elapsed"), line);
    }

    @Test
    void testDefaultIntervalIsATenthOfTheRun() {
        HarvestProgress progress = HarvestProgress.forTasks("big", 100);
        for (int i = 0; i < 100; i++) progress.taskSucceeded();
        assertEquals(10, progress.reportCount());

        HarvestProgress small = HarvestProgress.forTasks("small", 3);
        for (int i = 0; i < 3; i++) small.taskSucceeded();
        assertEquals(3, small.reportCount());
    }

    @Test
    void testConcurrentUpdatesAreAllCounted() throws Exception {
        HarvestProgress progress = HarvestProgress.forTasks("concurrent", 400);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 4; t++) {
            boolean fail = t == 0;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                    if (fail) progress.taskFailed(); else progress.taskSucceeded();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(300, progress.succeeded());
        assertEquals(100, progress.failed());
        assertEquals(0, progress.remaining());
        assertEquals(10, progress.reportCount());
    }

    @Test
    void testNegativeTotalRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HarvestProgress("x", -1, 1));
    }
}
