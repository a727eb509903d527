package com.gradspider.scraper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SessionFactory} producing {@link FakeSessionHandle}s, with scripted creation failures
 * and bookkeeping of how many sessions are still open.
 */
public class FakeSessionFactory implements SessionFactory {
    private final FakeWeb web;
    private final List<FakeSessionHandle> created = new CopyOnWriteArrayList<>();
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger peakOpen = new AtomicInteger();
    private volatile int failuresLeft;
    private volatile int succeedBeforeFailing = -1;

    public FakeSessionFactory(FakeWeb web) {
        this.web = web;
    }

    public FakeSessionFactory() {
        this(new FakeWeb());
    }

    /**
     * The next {@code n} creations fail.
     */
    public FakeSessionFactory failNext(int n) {
        failuresLeft = n;
        return this;
    }

    public FakeSessionFactory failAlways() {
        failuresLeft = Integer.MAX_VALUE;
        return this;
    }

    /**
     * The first {@code n} creations succeed and every later one fails.
     */
    public FakeSessionFactory failAfter(int n) {
        succeedBeforeFailing = n;
        return this;
    }

    @Override
    public SessionHandle create(String id, VisibilityMode visibility) throws SessionCreationException {
        int attempt = attempts.incrementAndGet();
        if (succeedBeforeFailing >= 0 && created.size() >= succeedBeforeFailing) {
            throw new SessionCreationException("browser launch refused (attempt " + attempt + ")", new IllegalStateException("no sandbox"));
        }
        synchronized (this) {
            if (failuresLeft > 0) {
                if (failuresLeft != Integer.MAX_VALUE) failuresLeft--;
                throw new SessionCreationException("browser launch refused (attempt " + attempt + ")", new IllegalStateException("no sandbox"));
            }
        }
        FakeSessionHandle session = new FakeSessionHandle(id, visibility, web);
        created.add(session);
        peakOpen.accumulateAndGet(openCount(), Math::max);
        return session;
    }

    public List<FakeSessionHandle> created() {
        return created;
    }

    public int createdCount() {
        return created.size();
    }

    public int attemptCount() {
        return attempts.get();
    }

    /**
     * Sessions created and not yet closed.
     */
    public int openCount() {
        return (int) created.stream().filter(s -> !s.closed()).count();
    }

    public int peakOpen() {
        return peakOpen.get();
    }
}
