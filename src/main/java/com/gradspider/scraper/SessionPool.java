package com.gradspider.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity pool of browser sessions lent to Harvesters under an acquire/release discipline.
 * <p>
 * Sessions are created lazily up to capacity (or eagerly through {@link #warmUp()}). A slot is
 * reserved under the lock and the slow browser launch happens outside it. Callers that find the pool
 * at capacity wait on a fair lock's condition queue until a release frees a session or a slot.
 * Sessions released as dead are torn down and their slot is backfilled on a later acquire.
 * <p>
 * Idle set, in-use set and slot counters are guarded by a single {@link ReentrantLock}; no browser
 * call is made while holding it.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class SessionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SessionPool.class);

    public static final int DEFAULT_MAX_CREATION_FAILURES = 3;

    private final SessionFactory factory;
    private final int capacity;
    private final VisibilityMode visibility;
    private final int maxCreationFailures;
    private final Duration drainTimeout;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition available = lock.newCondition();
    private final Condition settled = lock.newCondition();
    private final Deque<SessionHandle> idle = new ArrayDeque<>();
    private final Set<SessionHandle> inUse = Collections.newSetFromMap(new IdentityHashMap<>());
    private final AtomicInteger sequence = new AtomicInteger();

    // all guarded by lock
    private int pendingCreations;
    private int closing;
    private int consecutiveCreationFailures;
    private int peakInUse;
    private int created;
    private int discarded;
    private boolean unavailable;
    private String unavailableReason;
    private boolean draining;
    private boolean drained;

    public SessionPool(SessionFactory factory, int capacity, VisibilityMode visibility) {
        this(factory, capacity, visibility, DEFAULT_MAX_CREATION_FAILURES, Duration.ofSeconds(60));
    }

    public SessionPool(SessionFactory factory, int capacity, VisibilityMode visibility,
                       int maxCreationFailures, Duration drainTimeout) {
        if (factory == null) throw new IllegalArgumentException("Session factory cannot be null");
        if (capacity < 1) throw new IllegalArgumentException("Pool capacity must be at least 1, was " + capacity);
        if (maxCreationFailures < 1) throw new IllegalArgumentException("maxCreationFailures must be at least 1");
        this.factory = factory;
        this.capacity = capacity;
        this.visibility = visibility == null ? VisibilityMode.HEADLESS : visibility;
        this.maxCreationFailures = maxCreationFailures;
        this.drainTimeout = drainTimeout;
    }

    /**
     * Borrows a session for exclusive use until {@link #release}.
     * @param timeout how long to wait for a session when the pool is at capacity
     * @return a HEALTHY or DEGRADED session
     * @throws PoolExhaustedException if nothing became available within {@code timeout}
     * @throws PoolUnavailableException if session creation keeps failing or the pool is draining
     * @throws InterruptedException if the caller is interrupted while waiting
     */
    public SessionHandle acquire(Duration timeout) throws PoolExhaustedException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            SessionHandle idleSession = takeIdleOrReserveSlot(deadline);
            if (idleSession != null) return idleSession;
            SessionHandle fresh = createInReservedSlot(true);
            if (fresh != null) return fresh;
            // non-fatal creation failure: the slot was given back, try again within the same deadline
        }
    }

    /**
     * Returns a borrowed session. {@link ReleaseOutcome#DEGRADED} worsens its health by one step;
     * a session that ends up DEAD, cannot be reset, or is no longer alive is destroyed and its slot
     * freed for backfill.
     */
    public void release(SessionHandle session, ReleaseOutcome outcome) {
        if (session == null) throw new IllegalArgumentException("Session cannot be null");
        ReleaseOutcome effective = outcome == null ? ReleaseOutcome.OK : outcome;
        HealthState next = switch (effective) {
            case OK -> session.health();
            case DEGRADED -> session.health().worsen();
            case DEAD -> HealthState.DEAD;
        };
        // the caller still owns the session here, so it is safe to drive it outside the lock
        if (next != HealthState.DEAD && (!session.isAlive() || !session.resetState())) {
            logger.warn("Session {} is no longer usable after reset; discarding it.", session.id());
            next = HealthState.DEAD;
        }

        boolean discard;
        lock.lock();
        try {
            if (drained) {
                logger.debug("Session {} released after drain; already closed.", session.id());
                return;
            }
            if (!inUse.remove(session)) {
                throw new IllegalArgumentException("Session " + session.id() + " is not checked out of this pool");
            }
            session.markHealth(next);
            discard = session.health() == HealthState.DEAD || draining;
            if (discard) {
                closing++;
                discarded++;
                // the freed slot can be backfilled by a waiter
                available.signal();
            } else {
                idle.addLast(session);
                available.signal();
            }
            settled.signalAll();
        } finally {
            lock.unlock();
        }

        if (discard) {
            try {
                session.close();
                if (session.health() == HealthState.DEAD && effective != ReleaseOutcome.OK) {
                    logger.info("Discarded {} session {}; slot will be backfilled.", effective, session.id());
                }
            } finally {
                lock.lock();
                try {
                    closing--;
                    settled.signalAll();
                } finally {
                    lock.unlock();
                }
            }
        } else if (effective == ReleaseOutcome.DEGRADED) {
            logger.info("Session {} marked {}.", session.id(), session.health());
        }
    }

    /**
     * Pre-creates sessions up to capacity so the first tasks do not pay the browser launch cost.
     * @throws PoolUnavailableException if creation fails {@code maxCreationFailures} times in a row
     */
    public void warmUp() {
        logger.info("Warming up session pool to {} sessions ({}).", capacity, visibility);
        // a failed creation gives its slot back, so this loops until full or the failure limit throws
        while (reserveSlotIfBelowCapacity()) {
            createInReservedSlot(false);
        }
        logger.info("Session pool warm: {} idle sessions.", idleCount());
    }

    private boolean reserveSlotIfBelowCapacity() {
        lock.lock();
        try {
            ensureUsable();
            if (liveCountLocked() >= capacity) return false;
            pendingCreations++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to the configured drain timeout for in-use sessions to come back, then closes every session.
     */
    public void drain() {
        drain(drainTimeout);
    }

    /**
     * Scoped teardown. Blocks new acquires, waits up to {@code timeout} for borrowed sessions to be
     * released, then destroys all sessions, force-closing any still borrowed. Subsequent calls return
     * immediately.
     */
    public void drain(Duration timeout) {
        List<SessionHandle> toClose = new ArrayList<>();
        boolean interrupted = false;
        lock.lock();
        try {
            if (drained) return;
            draining = true;
            available.signalAll();
            long remaining = timeout.toNanos();
            while ((!inUse.isEmpty() || pendingCreations > 0 || closing > 0) && remaining > 0L) {
                try {
                    remaining = settled.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    interrupted = true;
                    break;
                }
            }
            if (!inUse.isEmpty()) {
                logger.warn("Force-closing {} sessions still in use after drain wait.", inUse.size());
            }
            toClose.addAll(idle);
            toClose.addAll(inUse);
            idle.clear();
            inUse.clear();
            drained = true;
        } finally {
            lock.unlock();
        }
        for (SessionHandle s : toClose) {
            try {
                s.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to close session {} during drain: {}", s.id(), e.getMessage());
            }
        }
        logger.info("Session pool drained: closed {} sessions (created {}, discarded {}, peak in use {}).",
            toClose.size(), createdCount(), discardedCount(), peakInUse());
        if (interrupted) Thread.currentThread().interrupt();
    }

    @Override
    public void close() {
        drain();
    }

    private SessionHandle takeIdleOrReserveSlot(long deadline) throws PoolExhaustedException, InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                ensureUsable();
                SessionHandle s = idle.pollFirst();
                if (s != null) {
                    checkOutLocked(s);
                    return s;
                }
                if (liveCountLocked() < capacity) {
                    pendingCreations++;
                    return null;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    throw new PoolExhaustedException("No browser session available within timeout (capacity "
                        + capacity + ", in use " + inUse.size() + ")");
                }
                try {
                    available.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    // pass on a signal this thread may have consumed
                    available.signal();
                    throw e;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates a session in a slot already counted in {@code pendingCreations}.
     * @param checkOut true to hand the session to the caller, false to park it idle
     * @return the session, or null after a non-fatal failure (slot released)
     */
    private SessionHandle createInReservedSlot(boolean checkOut) {
        String id = "session-" + sequence.incrementAndGet();
        SessionHandle session;
        try {
            session = factory.create(id, visibility);
        } catch (SessionCreationException | RuntimeException e) {
            int failures;
            boolean fatal;
            lock.lock();
            try {
                pendingCreations--;
                failures = ++consecutiveCreationFailures;
                fatal = failures >= maxCreationFailures;
                if (fatal) {
                    unavailable = true;
                    unavailableReason = "session creation failed " + failures + " times in a row: " + e.getMessage();
                    available.signalAll();
                } else {
                    available.signal();
                }
                settled.signalAll();
            } finally {
                lock.unlock();
            }
            if (fatal) {
                logger.error("Browser session creation failed {} times in a row; pool unavailable: {}", failures, e.getMessage());
                throw new PoolUnavailableException("Cannot create browser sessions: " + e.getMessage(), e);
            }
            logger.warn("Failed to create browser session {} (consecutive failure {}): {}", id, failures, e.getMessage());
            return null;
        }

        boolean rejected;
        lock.lock();
        try {
            pendingCreations--;
            consecutiveCreationFailures = 0;
            created++;
            rejected = draining;
            if (!rejected) {
                if (checkOut) {
                    checkOutLocked(session);
                } else {
                    idle.addLast(session);
                    available.signal();
                }
            } else {
                closing++;
            }
            settled.signalAll();
        } finally {
            lock.unlock();
        }
        if (rejected) {
            try {
                session.close();
            } finally {
                lock.lock();
                try {
                    closing--;
                    settled.signalAll();
                } finally {
                    lock.unlock();
                }
            }
            throw new PoolUnavailableException("Session pool is draining");
        }
        logger.info("Created browser session {} ({}).", id, visibility);
        return session;
    }

    private void checkOutLocked(SessionHandle s) {
        inUse.add(s);
        peakInUse = Math.max(peakInUse, inUse.size());
    }

    private void ensureUsable() {
        if (unavailable) throw new PoolUnavailableException("Session pool unavailable: " + unavailableReason);
        if (draining) throw new PoolUnavailableException("Session pool is draining");
    }

    private int liveCountLocked() {
        return idle.size() + inUse.size() + pendingCreations;
    }

    public int capacity() {
        return capacity;
    }

    public VisibilityMode visibility() {
        return visibility;
    }

    /**
     * Sessions currently created or being created, idle or borrowed.
     */
    public int liveCount() {
        lock.lock();
        try {
            return liveCountLocked() + closing;
        } finally {
            lock.unlock();
        }
    }

    public int inUseCount() {
        lock.lock();
        try {
            return inUse.size();
        } finally {
            lock.unlock();
        }
    }

    public int idleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    public int peakInUse() {
        lock.lock();
        try {
            return peakInUse;
        } finally {
            lock.unlock();
        }
    }

    public int createdCount() {
        lock.lock();
        try {
            return created;
        } finally {
            lock.unlock();
        }
    }

    public int discardedCount() {
        lock.lock();
        try {
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDrained() {
        lock.lock();
        try {
            return drained;
        } finally {
            lock.unlock();
        }
    }
}
