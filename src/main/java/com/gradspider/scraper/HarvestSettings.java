package com.gradspider.scraper;

import java.time.Duration;

/**
 * Configuration surface consumed by the pool and the harvesting pipeline.
 *
 * @param poolCapacity        maximum number of live browser sessions
 * @param operationTimeout    bound on every navigation and element wait
 * @param visibility          headless or headful sessions
 * @param acquireTimeout      how long a Harvester waits on the pool per attempt
 * @param maxAcquireAttempts  attempts before a task is recorded as failed with POOL_EXHAUSTED
 * @param acquireBackoff      initial pause between attempts, doubled each time
 * @param maxConcurrency      hard ceiling on Harvester threads per run
 * @param warmStart           pre-create all sessions before dispatching tasks
 * @param drainTimeout        how long teardown waits for borrowed sessions
 * @param maxCreationFailures consecutive launch failures that make the pool unavailable
 * @param outputDir           directory the CSV sink writes into
 */
public record HarvestSettings(
    int poolCapacity,
    Duration operationTimeout,
    VisibilityMode visibility,
    Duration acquireTimeout,
    int maxAcquireAttempts,
    Duration acquireBackoff,
    int maxConcurrency,
    boolean warmStart,
    Duration drainTimeout,
    int maxCreationFailures,
    String outputDir
) {
    public HarvestSettings {
        if (poolCapacity < 1) throw new IllegalArgumentException("pool.capacity must be >= 1, was " + poolCapacity);
        requirePositive(operationTimeout, "operation.timeout");
        requirePositive(acquireTimeout, "acquire.timeout");
        requirePositive(drainTimeout, "drain.timeout");
        if (acquireBackoff == null || acquireBackoff.isNegative()) {
            throw new IllegalArgumentException("acquire.backoff must not be negative");
        }
        if (maxAcquireAttempts < 1) throw new IllegalArgumentException("acquire.max.attempts must be >= 1");
        if (maxConcurrency < 1) throw new IllegalArgumentException("max.concurrency must be >= 1");
        if (maxCreationFailures < 1) throw new IllegalArgumentException("pool.max.creation.failures must be >= 1");
        visibility = visibility == null ? VisibilityMode.HEADLESS : visibility;
        outputDir = outputDir == null || outputDir.isBlank() ? "output" : outputDir;
    }

    public static HarvestSettings defaults() {
        return new HarvestSettings(4, Duration.ofSeconds(15), VisibilityMode.HEADLESS, Duration.ofSeconds(30), 3,
            Duration.ofMillis(500), 24, false, Duration.ofSeconds(60), SessionPool.DEFAULT_MAX_CREATION_FAILURES, "output");
    }

    /**
     * Applies the per-university overrides of {@code profile}.
     */
    public HarvestSettings forProfile(UniversityProfile profile) {
        int capacity = profile.poolCapacity() != null && profile.poolCapacity() > 0 ? profile.poolCapacity() : poolCapacity;
        Duration timeout = profile.timeoutSeconds() != null && profile.timeoutSeconds() > 0
            ? Duration.ofSeconds(profile.timeoutSeconds()) : operationTimeout;
        VisibilityMode mode = profile.visibility() != null ? profile.visibility() : visibility;
        return new HarvestSettings(capacity, timeout, mode, acquireTimeout, maxAcquireAttempts, acquireBackoff,
            maxConcurrency, warmStart, drainTimeout, maxCreationFailures, outputDir);
    }

    public HarvestSettings withPoolCapacity(int capacity) {
        return new HarvestSettings(capacity, operationTimeout, visibility, acquireTimeout, maxAcquireAttempts,
            acquireBackoff, maxConcurrency, warmStart, drainTimeout, maxCreationFailures, outputDir);
    }

    public HarvestSettings withOutputDir(String dir) {
        return new HarvestSettings(poolCapacity, operationTimeout, visibility, acquireTimeout, maxAcquireAttempts,
            acquireBackoff, maxConcurrency, warmStart, drainTimeout, maxCreationFailures, dir);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
    }
}
