package com.tracechain.bridge;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Insertion-ordered set of original event ids already relayed by one bridge. Once {@link #trimIfNeeded()} finds
 * more than {@code highWater} entries it evicts the oldest, keeping the {@code trimTo} most recently added.
 * Held in memory only; a restart forgets it.
 */
public class ProcessedEventSet {

    public static final int HIGH_WATER = 10_000;
    public static final int TRIM_TO = 5_000;

    private final LinkedHashSet<String> ids = new LinkedHashSet<>();
    private final int highWater;
    private final int trimTo;

    public ProcessedEventSet() {
        this(HIGH_WATER, TRIM_TO);
    }

    public ProcessedEventSet(int highWater, int trimTo) {
        if (trimTo < 0 || trimTo > highWater) {
            throw new IllegalArgumentException("Require 0 <= trimTo <= highWater");
        }
        this.highWater = highWater;
        this.trimTo = trimTo;
    }

    public synchronized boolean contains(String originalEventId) {
        return ids.contains(originalEventId);
    }

    /** Re-adding an id moves it to the most recent position. */
    public synchronized void add(String originalEventId) {
        ids.remove(originalEventId);
        ids.add(originalEventId);
    }

    public synchronized int size() {
        return ids.size();
    }

    /**
     * @return number of evicted ids
     */
    public synchronized int trimIfNeeded() {
        if (ids.size() <= highWater) {
            return 0;
        }
        int evict = ids.size() - trimTo;
        Iterator<String> it = ids.iterator();
        for (int i = 0; i < evict; i++) {
            it.next();
            it.remove();
        }
        return evict;
    }

    /** Oldest first. */
    public synchronized List<String> snapshot() {
        return new ArrayList<>(ids);
    }
}
