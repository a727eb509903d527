package com.gradspider.scraper;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-level cancellation flag shared by a {@link Coordinator} and its Harvesters.
 * Checked before every Harvester iteration; the first reason given wins.
 */
public class RunSignal {
    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * @return true if this call raised the signal, false if it was already raised
     */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why == null || why.isBlank() ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * Reason given to the first {@link #cancel} call, or null while the run is live.
     */
    public String reason() {
        return reason.get();
    }
}
