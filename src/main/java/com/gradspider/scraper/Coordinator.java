package com.gradspider.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one harvest: scans the list page, fans the tasks out to a fixed set of {@link Harvester}s
 * sharing one {@link SessionPool}, and always drains the pool before returning or throwing.
 * <p>
 * {@link #cancel(String)} may be called from any thread, typically a JVM shutdown hook.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class Coordinator {
    private static final Logger logger = LoggerFactory.getLogger(Coordinator.class);

    private final SessionFactory factory;
    private final HarvestSettings settings;
    private final ListScanner scanner;
    private final ProgramExtractor extractor;

    private volatile RunSignal currentSignal;
    private volatile ExecutorService currentExecutor;

    public Coordinator(SessionFactory factory, HarvestSettings settings, ListScanner scanner, ProgramExtractor extractor) {
        this.factory = factory;
        this.settings = settings;
        this.scanner = scanner;
        this.extractor = extractor;
    }

    HarvestSettings settings() {
        return settings;
    }

    /**
     * Harvests every program listed for {@code profile}.
     * @param concurrency requested number of Harvesters, capped by {@code max.concurrency} and by the pool capacity
     * @throws ListScanException if the list page could not be scanned
     * @throws PoolUnavailableException if browser sessions cannot be created
     */
    public HarvestResult run(UniversityProfile profile, int concurrency) {
        long started = System.nanoTime();
        HarvestSettings s = settings.forProfile(profile);
        int workers = Math.max(1, Math.min(Math.min(concurrency, s.maxConcurrency()), s.poolCapacity()));
        if (workers < concurrency) {
            logger.info("Requested {} harvesters for {}; running {} (max concurrency {}, pool capacity {}).",
                concurrency, profile.key(), workers, s.maxConcurrency(), s.poolCapacity());
        }
        RunSignal signal = new RunSignal();
        currentSignal = signal;

        SessionPool pool = new SessionPool(factory, s.poolCapacity(), s.visibility(), s.maxCreationFailures(), s.drainTimeout());
        TaskQueue queue = new TaskQueue();
        Deduplicator deduplicator = new Deduplicator();
        Queue<FailedTask> failures = new ConcurrentLinkedQueue<>();
        List<Throwable> crashes = new ArrayList<>();
        PoolUnavailableException fatal = null;
        ExecutorService executor = null;
        int taskCount = 0;

        logger.info("Harvesting {} ({}) with {} harvesters, pool capacity {}, {}",
            profile.code(), profile.name(), workers, s.poolCapacity(), s.visibility());
        try {
            if (s.warmStart()) pool.warmUp();

            List<DiscoveryTask> tasks = scanList(pool, profile, s);
            taskCount = tasks.size();
            queue.pushAll(tasks);
            queue.close();

            if (signal.isCancelled()) {
                logger.warn("Run cancelled before dispatch: {}", signal.reason());
            } else if (!tasks.isEmpty()) {
                executor = Executors.newFixedThreadPool(workers, harvesterThreads(profile.key()));
                currentExecutor = executor;
                HarvestProgress progress = HarvestProgress.forTasks(profile.key(), taskCount);
                fatal = dispatch(executor, workers, queue, pool, deduplicator, failures, signal, s, progress, crashes);
            }
        } finally {
            queue.close();
            if (executor != null) shutdown(executor, signal.isCancelled() || fatal != null, s.drainTimeout());
            currentExecutor = null;
            if (currentSignal == signal) currentSignal = null;
            pool.drain();
            deduplicator.close();
        }

        List<DiscoveryTask> leftover = queue.drainRemaining();
        if (!leftover.isEmpty()) {
            String why = leftoverReason(fatal, signal, crashes);
            logger.warn("{} tasks of {} were not processed: {}", leftover.size(), profile.key(), why);
            for (DiscoveryTask left : leftover) {
                failures.add(new FailedTask(left, ExtractionErrorKind.CANCELLED, "Not processed: " + why));
            }
        }
        if (fatal != null) {
            logger.error("Harvest of {} aborted: {}", profile.code(), fatal.getMessage());
            throw fatal;
        }

        HarvestResult result = new HarvestResult(profile.code(), deduplicator.acceptedRecords(), new ArrayList<>(failures),
            deduplicator.duplicateCount(), taskCount, Duration.ofNanos(System.nanoTime() - started), signal.isCancelled());
        logger.info("Harvest finished. {}", result.summary());
        return result;
    }

    /**
     * Raises the run signal and interrupts blocked Harvesters. Does nothing when no run is active.
     * @return true if an active run was cancelled by this call
     */
    public boolean cancel(String reason) {
        RunSignal signal = currentSignal;
        if (signal == null || !signal.cancel(reason)) return false;
        logger.warn("Cancelling harvest: {}", reason);
        ExecutorService executor = currentExecutor;
        if (executor != null) executor.shutdownNow();
        return true;
    }

    private static String leftoverReason(PoolUnavailableException fatal, RunSignal signal, List<Throwable> crashes) {
        if (fatal != null) return fatal.getMessage();
        if (signal.isCancelled()) return signal.reason();
        if (!crashes.isEmpty()) return "harvesters crashed (" + crashes.get(0) + ")";
        return "all harvesters stopped";
    }

    private List<DiscoveryTask> scanList(SessionPool pool, UniversityProfile profile, HarvestSettings s) {
        SessionHandle session;
        try {
            session = pool.acquire(s.acquireTimeout());
        } catch (PoolExhaustedException e) {
            throw new ListScanException("No browser session for the list scan of " + profile.key(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ListScanException("Interrupted before the list scan of " + profile.key(), e);
        }
        ReleaseOutcome outcome = ReleaseOutcome.OK;
        try {
            List<DiscoveryTask> tasks = scanner.scan(session, profile);
            session.recordSuccess();
            logger.info("List scan of {} found {} programs.", profile.key(), tasks.size());
            return tasks;
        } catch (ExtractionException e) {
            ExtractionErrorKind kind = ErrorClassifier.classify(e);
            if (kind == ExtractionErrorKind.TIMEOUT) session.recordTimeout();
            outcome = ErrorClassifier.outcomeFor(kind, session);
            throw new ListScanException("List scan of " + profile.key() + " failed (" + kind + "): " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ListScanException("List scan of " + profile.key() + " failed: " + e.getMessage(), e);
        } finally {
            pool.release(session, outcome);
        }
    }

    private PoolUnavailableException dispatch(ExecutorService executor, int workers, TaskQueue queue, SessionPool pool,
                                              Deduplicator deduplicator, Queue<FailedTask> failures, RunSignal signal,
                                              HarvestSettings s, HarvestProgress progress, List<Throwable> crashes) {
        ExecutorCompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
        int submitted = 0;
        try {
            for (int i = 0; i < workers; i++) {
                completion.submit(new Harvester(queue, pool, extractor, deduplicator, failures, signal, s, progress));
                submitted++;
            }
        } catch (RejectedExecutionException e) {
            logger.warn("Stopped launching harvesters after {}: {}", submitted, e.getMessage());
        }

        PoolUnavailableException fatal = null;
        for (int i = 0; i < submitted; i++) {
            Future<Integer> done;
            try {
                done = completion.take();
            } catch (InterruptedException e) {
                signal.cancel("coordinator interrupted");
                executor.shutdownNow();
                Thread.currentThread().interrupt();
                break;
            }
            try {
                Integer taken = done.get();
                logger.debug("Harvester completed {} tasks.", taken);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof PoolUnavailableException pue) {
                    if (fatal == null) {
                        fatal = pue;
                        signal.cancel("pool unavailable");
                        executor.shutdownNow();
                    }
                } else {
                    crashes.add(cause);
                    logger.error("Harvester crashed: {}", String.valueOf(cause));
                }
            } catch (InterruptedException e) {
                // get() on a completed future does not block
                Thread.currentThread().interrupt();
            }
        }
        return fatal;
    }

    private static void shutdown(ExecutorService executor, boolean now, Duration wait) {
        if (now) {
            executor.shutdownNow();
        } else {
            executor.shutdown();
        }
        try {
            if (!executor.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Harvester threads still running after {} s; draining the pool anyway.", wait.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory harvesterThreads(String key) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "harvester-" + key + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
