package com.gradspider.scraper;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Identity, health and lifecycle bookkeeping shared by every {@link SessionHandle} implementation.
 */
public abstract class AbstractSessionHandle implements SessionHandle {
    private final String id;
    private final VisibilityMode visibility;
    private final Instant createdAt = Instant.now();
    private final AtomicReference<HealthState> health = new AtomicReference<>(HealthState.HEALTHY);
    private final AtomicInteger consecutiveTimeouts = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    protected AbstractSessionHandle(String id, VisibilityMode visibility) {
        this.id = id;
        this.visibility = visibility;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public VisibilityMode visibility() {
        return visibility;
    }

    @Override
    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public HealthState health() {
        return health.get();
    }

    @Override
    public void markHealth(HealthState next) {
        health.updateAndGet(current -> current.advanceTo(next));
    }

    @Override
    public int consecutiveTimeouts() {
        return consecutiveTimeouts.get();
    }

    @Override
    public void recordTimeout() {
        consecutiveTimeouts.incrementAndGet();
    }

    @Override
    public void recordSuccess() {
        consecutiveTimeouts.set(0);
    }

    @Override
    public final void close() {
        if (closed.compareAndSet(false, true)) {
            markHealth(HealthState.DEAD);
            doClose();
        }
    }

    protected boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases native resources. Called at most once.
     */
    protected abstract void doClose();

    @Override
    public String toString() {
        return id + "[" + health() + ", " + visibility + "]";
    }
}
