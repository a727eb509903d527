package com.gradspider.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gate that lets at most one record per {@link Fingerprint} through within a run.
 * <p>
 * The seen-set maps each fingerprint to the first record accepted for it, in acceptance order.
 * All mutation happens inside one monitor, so among concurrent duplicates exactly one is accepted.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class Deduplicator {
    private static final Logger logger = LoggerFactory.getLogger(Deduplicator.class);

    public enum OfferResult {
        ACCEPTED,
        REJECTED_DUPLICATE
    }

    private final Map<Fingerprint, RawRecord> seen = new LinkedHashMap<>();
    private int duplicates;
    private boolean closed;

    public static Fingerprint fingerprint(RawRecord record) {
        return Fingerprint.of(record);
    }

    /**
     * Accepts {@code record} if its fingerprint has not been seen in this run.
     * @throws IllegalStateException if the input was closed
     */
    public OfferResult offer(RawRecord record) {
        if (record == null) throw new IllegalArgumentException("Record cannot be null");
        Fingerprint fp = Fingerprint.of(record);
        synchronized (this) {
            if (closed) throw new IllegalStateException("Deduplicator input is closed");
            if (seen.putIfAbsent(fp, record) == null) {
                return OfferResult.ACCEPTED;
            }
            duplicates++;
        }
        logger.debug("Rejected duplicate program '{}' ({})", record.programName(), record.detailUrl());
        return OfferResult.REJECTED_DUPLICATE;
    }

    /**
     * Offers each record in order and returns the accepted ones.
     */
    public List<RawRecord> filter(List<RawRecord> records) {
        List<RawRecord> accepted = new ArrayList<>();
        for (RawRecord r : records) {
            if (offer(r) == OfferResult.ACCEPTED) accepted.add(r);
        }
        return accepted;
    }

    public synchronized List<RawRecord> acceptedRecords() {
        return List.copyOf(seen.values());
    }

    public synchronized int acceptedCount() {
        return seen.size();
    }

    public synchronized int duplicateCount() {
        return duplicates;
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
