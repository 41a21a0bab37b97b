package com.tracechain.bridge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tracechain.domain.LedgerId;

import java.time.Instant;
import java.util.Set;

/**
 * Bridge status as reported by the manager. {@code running} reflects whether the manager holds a live worker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeStatus(
        String name,
        LedgerId sourceChain,
        LedgerId targetChain,
        boolean running,
        Instant lastRun,
        long intervalSeconds,
        int confirmationBlocks,
        Set<String> eventTypes,
        Long lastProcessedBlock,
        int processedEventCount,
        int consecutiveFailures,
        String lastError
) {
}
