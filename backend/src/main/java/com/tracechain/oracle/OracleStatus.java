package com.tracechain.oracle;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Snapshot of an oracle's lifecycle state. {@code lastRun} is null until the first cycle finishes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OracleStatus(
        String name,
        boolean running,
        Instant lastRun,
        long intervalSeconds,
        int consecutiveFailures,
        String lastError
) {
}
