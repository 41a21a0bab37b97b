package com.tracechain.ledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger call retry policy (exponential backoff ± jitter). Applies to reads; submissions are sent once.
 */
@ConfigurationProperties(prefix = "tracechain.ledger.retry")
@NoArgsConstructor
@Getter
@Setter
public class LedgerRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Upper bound of a single retry delay. */
    private long maxDelayMs = 8_000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Total attempts including the first call. */
    private int maxAttempts = 3;

    /** Time to skip an endpoint after a connectivity failure. */
    private long endpointCooldownMs = 30_000L;
}
