package com.tracechain.bridge;

import com.tracechain.ledger.BridgeEvent;

import java.util.List;

/**
 * Confirmed source events of one cycle, discovered in blocks {@code (fromExclusive, toInclusive]}.
 */
public record BridgeEventBatch(long head, long fromExclusive, long toInclusive, List<BridgeEvent> events) {

    public BridgeEventBatch {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static BridgeEventBatch empty(long head, long fromExclusive, long toInclusive) {
        return new BridgeEventBatch(head, fromExclusive, toInclusive, List.of());
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
