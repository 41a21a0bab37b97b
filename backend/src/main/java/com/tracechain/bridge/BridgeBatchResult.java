package com.tracechain.bridge;

import java.time.Instant;
import java.util.List;

/**
 * Result of one processing cycle. {@code processedCount} counts attempted relays, successful or not;
 * already-relayed events are skipped and not counted.
 */
public record BridgeBatchResult(int processedCount, List<RelayResult> results, Instant timestamp) {

    public BridgeBatchResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long successCount() {
        return results.stream().filter(RelayResult::isSuccess).count();
    }

    public long errorCount() {
        return results.size() - successCount();
    }
}
