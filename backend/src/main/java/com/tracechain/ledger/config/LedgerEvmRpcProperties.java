package com.tracechain.ledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * EVM JSON-RPC throttling for this service instance.
 */
@ConfigurationProperties(prefix = "tracechain.ledger.evm-rpc")
@NoArgsConstructor
@Getter
@Setter
public class LedgerEvmRpcProperties {

    /** Global EVM RPC budget (requests per second). */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a local limiter permit before failing. */
    private long localLimiterTimeoutMs = 2_000;
}
