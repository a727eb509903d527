package com.gradspider.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.Callable;

/**
 * Worker that repeatedly takes a task, borrows a session, extracts one record and gives the
 * session back, until the queue yields its sentinel or the run is cancelled.
 * <p>
 * Per-task failures are classified and recorded; they never end the loop. Only a
 * {@link PoolUnavailableException} escapes, ending this worker and, through the
 * {@link Coordinator}, the run. An {@link Error} thrown by the extractor also ends this worker,
 * after its task has been recorded as failed.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class Harvester implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(Harvester.class);

    static final int MAX_BACKOFF_MULTIPLIER = 8;

    private final TaskQueue queue;
    private final SessionPool pool;
    private final ProgramExtractor extractor;
    private final Deduplicator deduplicator;
    private final Queue<FailedTask> failures;
    private final RunSignal signal;
    private final HarvestSettings settings;
    private final HarvestProgress progress;

    public Harvester(TaskQueue queue, SessionPool pool, ProgramExtractor extractor, Deduplicator deduplicator,
                     Queue<FailedTask> failures, RunSignal signal, HarvestSettings settings, HarvestProgress progress) {
        this.queue = queue;
        this.pool = pool;
        this.extractor = extractor;
        this.deduplicator = deduplicator;
        this.failures = failures;
        this.signal = signal;
        this.settings = settings;
        this.progress = progress;
    }

    /**
     * @return number of tasks this worker took off the queue
     * @throws PoolUnavailableException if the pool can no longer provide sessions
     */
    @Override
    public Integer call() {
        int taken = 0;
        while (!signal.isCancelled()) {
            Optional<DiscoveryTask> next;
            try {
                next = queue.pop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (next.isEmpty()) break;
            taken++;
            if (!process(next.get())) break;
        }
        logger.debug("Harvester finished after {} tasks{}", taken, signal.isCancelled() ? " (run cancelled)" : "");
        return taken;
    }

    /**
     * @return false if the worker should stop
     */
    private boolean process(DiscoveryTask task) {
        SessionHandle session;
        try {
            session = acquireWithRetry(task);
        } catch (InterruptedException e) {
            fail(task, ExtractionErrorKind.CANCELLED, "Interrupted while waiting for a browser session");
            Thread.currentThread().interrupt();
            return false;
        } catch (PoolUnavailableException e) {
            fail(task, ExtractionErrorKind.CANCELLED, e.getMessage());
            throw e;
        }
        if (session == null) return !signal.isCancelled();

        ReleaseOutcome outcome = ReleaseOutcome.OK;
        boolean keepGoing = true;
        try {
            RawRecord record = extractor.extract(session, task);
            session.recordSuccess();
            if (deduplicator.offer(record) == Deduplicator.OfferResult.ACCEPTED) {
                logger.info("Extracted '{}' from {}", record.programName(), record.detailUrl());
            }
            progress.taskSucceeded();
        } catch (ExtractionException e) {
            outcome = onFailure(task, session, e);
            keepGoing = ErrorClassifier.classify(e) != ExtractionErrorKind.CANCELLED;
        } catch (RuntimeException e) {
            outcome = onFailure(task, session, e);
        } catch (Error e) {
            logger.error("Harvester crashed extracting {} on {}: {}", task.locator(), session.id(), e.toString());
            fail(task, ExtractionErrorKind.UNEXPECTED, "Harvester crashed: " + e);
            outcome = ReleaseOutcome.DEAD;
            throw e;
        } finally {
            pool.release(session, outcome);
        }
        return keepGoing;
    }

    private ReleaseOutcome onFailure(DiscoveryTask task, SessionHandle session, Exception e) {
        ExtractionErrorKind kind = ErrorClassifier.classify(e);
        if (kind == ExtractionErrorKind.TIMEOUT) session.recordTimeout();
        if (kind == ExtractionErrorKind.CANCELLED) Thread.currentThread().interrupt();
        ReleaseOutcome outcome = ErrorClassifier.outcomeFor(kind, session);
        if (e instanceof RuntimeException) {
            logger.error("Unexpected error extracting {} on {}: {}", task.locator(), session.id(), e.toString());
        } else {
            logger.warn("Task {} failed on {} ({}): {}", task.locator(), session.id(), kind, e.getMessage());
        }
        fail(task, kind, e.getMessage());
        return outcome;
    }

    /**
     * @return a session, or null if the task was recorded as failed because none became available
     */
    private SessionHandle acquireWithRetry(DiscoveryTask task) throws InterruptedException {
        long base = settings.acquireBackoff().toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return pool.acquire(settings.acquireTimeout());
            } catch (PoolExhaustedException e) {
                if (attempt >= settings.maxAcquireAttempts()) {
                    logger.warn("No session for {} after {} attempts: {}", task.locator(), attempt, e.getMessage());
                    fail(task, ExtractionErrorKind.POOL_EXHAUSTED, e.getMessage());
                    return null;
                }
                if (signal.isCancelled()) {
                    fail(task, ExtractionErrorKind.CANCELLED, "Run cancelled: " + signal.reason());
                    return null;
                }
                long delay = Utils.backoffDelay(base, attempt, MAX_BACKOFF_MULTIPLIER);
                logger.debug("Pool exhausted for {} (attempt {}), backing off {} ms", task.locator(), attempt, delay);
                Thread.sleep(delay);
            }
        }
    }

    private void fail(DiscoveryTask task, ExtractionErrorKind kind, String reason) {
        failures.add(new FailedTask(task, kind, reason == null ? kind.name() : reason));
        progress.taskFailed();
    }
}
