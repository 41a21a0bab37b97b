package com.tracechain.ledger;

import java.util.List;

/**
 * Event-log facility of a ledger: head discovery and extraction of registered logistics events in a block range.
 */
public interface LedgerEventSource {

    /**
     * Current head block number (height) of the ledger.
     */
    long currentHead();

    /**
     * Events registered in blocks {@code (fromExclusive, toInclusive]}. Empty when {@code fromExclusive >= toInclusive}.
     */
    List<BridgeEvent> fetchEvents(long fromExclusive, long toInclusive);
}
