package com.tracechain.ledger;

import com.tracechain.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Round-robin node endpoint selection with per-endpoint cool-down and retry of connectivity failures.
 * Rejections are never retried: the node answered, asking again gives the same answer.
 */
@Slf4j
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;
    private final RetryPolicy retryPolicy;
    private final long cooldownMs;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy, long cooldownMs) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new LedgerConfigurationException("At least one node endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.cooldownMs = Math.max(0, cooldownMs);
    }

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        this(endpoints, retryPolicy, 0L);
    }

    /**
     * Next endpoint in round-robin order, skipping endpoints in cool-down. Falls back to plain round-robin when
     * every endpoint is cooling down.
     */
    public String getNextEndpoint() {
        long now = System.currentTimeMillis();
        for (int tries = 0; tries < endpoints.size(); tries++) {
            String candidate = endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
            Long until = cooldownUntilMs.get(candidate);
            if (until == null || until <= now) {
                return candidate;
            }
        }
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }

    /** Skip the endpoint for the configured cool-down after a connectivity failure. */
    public void markUnhealthy(String endpoint) {
        if (cooldownMs > 0) {
            cooldownUntilMs.put(endpoint, System.currentTimeMillis() + cooldownMs);
        }
    }

    /**
     * Runs {@code call} against successive endpoints until it succeeds, a non-connectivity failure occurs, or the
     * retry policy is exhausted.
     *
     * @param operation label for logs, e.g. "eth_getLogs"
     */
    public <T> T callWithRetry(String operation, Function<String, T> call) {
        return callWithRetry(operation, call, retryPolicy);
    }

    /** Single attempt on the next endpoint; for submissions that must not be repeated blindly. */
    public <T> T callOnce(String operation, Function<String, T> call) {
        return callWithRetry(operation, call, RetryPolicy.noRetry());
    }

    private <T> T callWithRetry(String operation, Function<String, T> call, RetryPolicy policy) {
        LedgerConnectivityException last = null;
        for (int attempt = 0; attempt < policy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(policy.delayMs(attempt - 1));
            }
            String endpoint = getNextEndpoint();
            try {
                return call.apply(endpoint);
            } catch (LedgerConnectivityException e) {
                last = e;
                markUnhealthy(endpoint);
                log.warn("{} failed on {} (attempt {}/{}): {}", operation, endpoint, attempt + 1,
                        policy.getMaxAttempts(), e.getMessage());
            }
        }
        throw last;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerConnectivityException("Interrupted during retry", e);
        }
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
