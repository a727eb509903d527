package com.gradspider.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.junit.jupiter.api.Assertions.*;

public class HarvesterTest {

    private static HarvestSettings settings() {
        return new HarvestSettings(1, Duration.ofSeconds(1), VisibilityMode.HEADLESS, Duration.ofMillis(50), 2,
            Duration.ofMillis(5), 4, false, Duration.ofSeconds(2), 3, "output");
    }

    private static HarvestProgress progress() {
        return new HarvestProgress("test", 10, 1);
    }

    private static TaskQueue queueOf(String... urls) {
        TaskQueue queue = new TaskQueue();
        for (String url : urls) queue.push(DiscoveryTask.ofUrl(url, ""));
        queue.close();
        return queue;
    }

    @Test
    void testSuccessfulExtractionsAreOfferedAndSessionReturned() {
        FakeSessionFactory factory = new FakeSessionFactory();
        SessionPool pool = new SessionPool(factory, 1, VisibilityMode.HEADLESS);
        Deduplicator dedup = new Deduplicator();
        Queue<FailedTask> failures = new ConcurrentLinkedQueue<>();
        ProgramExtractor extractor = (session, task) -> RawRecord.of("Program " + task.locator(), task.locator(), "HK001");

        int taken = new Harvester(queueOf("https://u/1", "https://u/2"), pool, extractor, dedup, failures, new RunSignal(), settings(), progress()).call();

        assertEquals(2, taken);
        assertEquals(2, dedup.acceptedCount());
        assertTrue(failures.isEmpty());
        assertEquals(1, pool.idleCount());
        assertEquals(1, factory.createdCount());
        pool.drain();
    }

    @Test
    void testRepeatedTimeoutsDegradeThenKillSession() {
        FakeSessionFactory factory = new FakeSessionFactory();
        SessionPool pool = new SessionPool(factory, 1, VisibilityMode.HEADLESS);
        Queue<FailedTask> failures = new ConcurrentLinkedQueue<>();
        ProgramExtractor extractor = (session, task) -> {
            throw new ExtractionTimeoutException("Waiting for 'h1' timed out");
        };

        new Harvester(queueOf("https://u/1", "https://u/2", "https://u/3"), pool, extractor, new Deduplicator(),
            failures, new RunSignal(), settings(), progress()).call();

        FakeSessionHandle first = factory.created().get(0);
        assertEquals(3, failures.size());
        assertTrue(failures.stream().allMatch(f -> f.kind() == ExtractionErrorKind.TIMEOUT));
        // 1st timeout keeps it healthy, 2nd degrades it, 3rd kills it
        assertEquals(HealthState.DEAD, first.health());
        assertTrue(first.closed());
        assertEquals(3, first.consecutiveTimeouts());
        assertEquals(1, pool.discardedCount());
        pool.drain();
    }

    @Test
    void testSuccessResetsTimeoutHistory() {
        FakeSessionFactory factory = new FakeSessionFactory();
        SessionPool pool = new SessionPool(factory, 1, VisibilityMode.HEADLESS);
        ProgramExtractor extractor = (session, task) -> {
            if (task.locator().endsWith("slow")) throw new ExtractionTimeoutException("timed out");
            return RawRecord.of("P", task.locator(), "X");
        };

        new Harvester(queueOf("https://u/slow", "https://u/ok", "https://u/slow"), pool, extractor, new Deduplicator(),
            new ConcurrentLinkedQueue<>(), new RunSignal(), settings(), progress()).call();

        FakeSessionHandle only = factory.created().get(0);
        assertEquals(HealthState.HEALTHY, only.health());
        assertEquals(1, only.consecutiveTimeouts());
        pool.drain();
    }

    @Test
    void testExhaustedPoolRecordsTaskAfterBoundedRetries() throws Exception {
        FakeSessionFactory factory = new FakeSessionFactory();
        SessionPool pool = new SessionPool(factory, 1, VisibilityMode.HEADLESS);
        SessionHandle hog = pool.acquire(Duration.ofSeconds(1));
        Queue<FailedTask> failures = new ConcurrentLinkedQueue<>();

        new Harvester(queueOf("https://u/1"), pool, (s, t) -> RawRecord.of("P", t.locator(), "X"), new Deduplicator(),
            failures, new RunSignal(), settings(), progress()).call();

        assertEquals(1, failures.size());
        assertEquals(ExtractionErrorKind.POOL_EXHAUSTED, failures.peek().kind());
        pool.release(hog, ReleaseOutcome.OK);
        pool.drain();
    }

    @Test
    void testUnexpectedRuntimeErrorIsRecordedAndLoopContinues() {
        SessionPool pool = new SessionPool(new FakeSessionFactory(), 1, VisibilityMode.HEADLESS);
        Deduplicator dedup = new Deduplicator();
        Queue<FailedTask> failures = new ConcurrentLinkedQueue<>();
        ProgramExtractor extractor = (session, task) -> {
            if (task.locator().endsWith("1")) throw new IllegalStateException("selector engine exploded");
            return RawRecord.of("P", task.locator(), "X");
        };

        int taken = new Harvester(queueOf("https://u/1", "https://u/2"), pool, extractor, dedup, failures,
            new RunSignal(), settings(), progress()).call();

        assertEquals(2, taken);
        assertEquals(1, dedup.acceptedCount());
        assertEquals(List.of(ExtractionErrorKind.UNEXPECTED), failures.stream().map(FailedTask::kind).toList());
        assertEquals(1, pool.idleCount(), "session stays in service after an unexpected error");
        pool.drain();
    }

    @Test
    void testCrashedSessionReleasedAsDead() {
        FakeSessionFactory factory = new FakeSessionFactory();
        SessionPool pool = new SessionPool(factory, 1, VisibilityMode.HEADLESS);
        Queue<FailedTask> failures = new ConcurrentLinkedQueue<>();
        ProgramExtractor extractor = (session, task) -> {
            if (task.locator().endsWith("1")) {
                ((FakeSessionHandle) session).crash();
                session.navigate(task.locator(), Duration.ofSeconds(1));
            }
            return RawRecord.of("P", task.locator(), "X");
        };

        new Harvester(queueOf("https://u/1", "https://u/2"), pool, extractor, new Deduplicator(), failures,
            new RunSignal(), settings(), progress()).call();

        assertEquals(ExtractionErrorKind.SESSION_CRASHED, failures.peek().kind());
        assertEquals(2, factory.createdCount(), "second task ran on a backfilled session");
        assertTrue(factory.created().get(0).closed());
        pool.drain();
    }

    @Test
    void testCancelledSignalStopsBeforeTakingWork() {
        SessionPool pool = new SessionPool(new FakeSessionFactory(), 1, VisibilityMode.HEADLESS);
        TaskQueue queue = queueOf("https://u/1", "https://u/2");
        RunSignal signal = new RunSignal();
        assertTrue(signal.cancel("stop"));
        assertFalse(signal.cancel("again"));

        int taken = new Harvester(queue, pool, (s, t) -> RawRecord.of("P", t.locator(), "X"), new Deduplicator(),
            new ConcurrentLinkedQueue<>(), signal, settings(), progress()).call();

        assertEquals(0, taken);
        assertEquals(2, queue.size());
        assertEquals("stop", signal.reason());
        pool.drain();
    }

    @Test
    void testPoolUnavailableEndsHarvester() {
        SessionPool pool = new SessionPool(new FakeSessionFactory().failAlways(), 1, VisibilityMode.HEADLESS);
        Queue<FailedTask> failures = new ConcurrentLinkedQueue<>();
        Harvester harvester = new Harvester(queueOf("https://u/1", "https://u/2"), pool,
            (s, t) -> RawRecord.of("P", t.locator(), "X"), new Deduplicator(), failures, new RunSignal(), settings(), progress());

        assertThrows(PoolUnavailableException.class, harvester::call);
        assertEquals(1, failures.size());
        assertEquals(ExtractionErrorKind.CANCELLED, failures.peek().kind());
        pool.drain();
    }

    @Test
    void testProgressCountsEveryFinishedTask() {
        SessionPool pool = new SessionPool(new FakeSessionFactory(), 1, VisibilityMode.HEADLESS);
        HarvestProgress progress = new HarvestProgress("test", 5, 2);
        ProgramExtractor extractor = (session, task) -> {
            if (task.locator().endsWith("/4")) throw new FieldMissingException("programName", task.locator());
            return RawRecord.of("Program " + task.locator(), task.locator(), "HK001");
        };

        new Harvester(queueOf("https://u/1", "https://u/2", "https://u/3", "https://u/4", "https://u/5"), pool, extractor,
            new Deduplicator(), new ConcurrentLinkedQueue<>(), new RunSignal(), settings(), progress).call();

        assertEquals(4, progress.succeeded());
        assertEquals(1, progress.failed());
        assertEquals(0, progress.remaining());
        // after tasks 2 and 4, then the last one
        assertEquals(3, progress.reportCount());
        pool.drain();
    }

    @Test
    void testErrorFromExtractorIsRecordedBeforeItEndsTheHarvester() {
        FakeSessionFactory factory = new FakeSessionFactory();
        SessionPool pool = new SessionPool(factory, 1, VisibilityMode.HEADLESS);
        Queue<FailedTask> failures = new ConcurrentLinkedQueue<>();
        TaskQueue queue = queueOf("https://u/1", "https://u/2", "https://u/3");
        ProgramExtractor extractor = (session, task) -> {
            if (task.locator().endsWith("/2")) throw new StackOverflowError();
            return RawRecord.of("Program " + task.locator(), task.locator(), "HK001");
        };
        Harvester harvester = new Harvester(queue, pool, extractor, new Deduplicator(), failures, new RunSignal(),
            settings(), progress());

        assertThrows(StackOverflowError.class, harvester::call);
        assertEquals(1, failures.size());
        FailedTask failed = failures.peek();
        assertEquals("https://u/2", failed.task().locator());
        assertEquals(ExtractionErrorKind.UNEXPECTED, failed.kind());
        assertTrue(failed.reason().contains("StackOverflowError"));
        assertEquals(HealthState.DEAD, factory.created().get(0).health());
        assertEquals(1, queue.size(), "the third task is left for the coordinator");
        pool.drain();
    }
}
