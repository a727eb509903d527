package com.gradspider.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live progress of one harvest, shared by its Harvesters.
 * <p>
 * Every finished task, successful or not, is counted once. A progress line is logged every
 * {@code interval} finished tasks and when the last task finishes.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class HarvestProgress {
    private static final Logger logger = LoggerFactory.getLogger(HarvestProgress.class);

    static final int REPORTS_PER_RUN = 10;

    private final String label;
    private final int total;
    private final int interval;
    private final long startedNanos = System.nanoTime();
    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger finished = new AtomicInteger();
    private final AtomicInteger reports = new AtomicInteger();

    /**
     * @param label    university key shown in each progress line
     * @param total    number of tasks in the run
     * @param interval finished tasks between two progress lines, at least 1
     */
    public HarvestProgress(String label, int total, int interval) {
        if (total < 0) throw new IllegalArgumentException("total must not be negative");
        this.label = label;
        this.total = total;
        this.interval = Math.max(1, interval);
    }

    /**
     * Progress for {@code total} tasks, reported roughly every tenth of the run.
     */
    public static HarvestProgress forTasks(String label, int total) {
        return new HarvestProgress(label, total, Math.max(1, total / REPORTS_PER_RUN));
    }

    public void taskSucceeded() {
        succeeded.incrementAndGet();
        maybeReport(finished.incrementAndGet());
    }

    public void taskFailed() {
        failed.incrementAndGet();
        maybeReport(finished.incrementAndGet());
    }

    public int succeeded() {
        return succeeded.get();
    }

    public int failed() {
        return failed.get();
    }

    public int completed() {
        return finished.get();
    }

    public int remaining() {
        return Math.max(0, total - completed());
    }

    /**
     * Number of progress lines logged so far.
     */
    public int reportCount() {
        return reports.get();
    }

    public String describe() {
        long elapsedMillis = (System.nanoTime() - startedNanos) / 1_000_000L;
        return String.format(Locale.ROOT, "%s: %d/%d done (%d ok, %d failed), %d remaining, %.1fs elapsed",
            label, completed(), total, succeeded(), failed(), remaining(), elapsedMillis / 1000.0);
    }

    private void maybeReport(int done) {
        if (done % interval == 0 || done == total) {
            reports.incrementAndGet();
            logger.info("Progress {}", describe());
        }
    }
}
