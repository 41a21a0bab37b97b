package com.tracechain.bridge;

import com.tracechain.domain.LedgerId;

import java.time.Duration;
import java.util.Set;

/**
 * Configuration of one relay direction.
 *
 * @param source             ledger whose events are discovered
 * @param target             ledger the events are relayed to
 * @param eventTypes         allow-list of event types; empty relays every type
 * @param confirmationBlocks blocks that must follow an event's block before it is relayed
 * @param pollInterval       sleep between cycles
 * @param lookbackBlocks     how far behind the head the first cycle starts
 */
public record BridgeSettings(
        LedgerId source,
        LedgerId target,
        Set<String> eventTypes,
        int confirmationBlocks,
        Duration pollInterval,
        long lookbackBlocks
) {

    public static final int DEFAULT_CONFIRMATION_BLOCKS = 5;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(300);
    public static final long DEFAULT_LOOKBACK_BLOCKS = 1000;

    public BridgeSettings {
        if (source == null || target == null) {
            throw new IllegalArgumentException("Source and target ledgers are required");
        }
        if (source == target) {
            throw new IllegalArgumentException("Source and target ledgers must differ: " + source);
        }
        if (confirmationBlocks < 0) {
            throw new IllegalArgumentException("confirmationBlocks must be >= 0");
        }
        if (lookbackBlocks < 0) {
            throw new IllegalArgumentException("lookbackBlocks must be >= 0");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public static BridgeSettings of(LedgerId source, LedgerId target) {
        return new BridgeSettings(source, target, Set.of(), DEFAULT_CONFIRMATION_BLOCKS, DEFAULT_POLL_INTERVAL,
                DEFAULT_LOOKBACK_BLOCKS);
    }

    /** {@code ChainBridge_{source}_to_{target}}. */
    public String name() {
        return nameFor(source, target);
    }

    public static String nameFor(LedgerId source, LedgerId target) {
        return "ChainBridge_" + source.key() + "_to_" + target.key();
    }

    /** Same settings in the opposite direction. */
    public BridgeSettings reversed() {
        return new BridgeSettings(target, source, eventTypes, confirmationBlocks, pollInterval, lookbackBlocks);
    }

    public boolean accepts(String eventType) {
        return eventTypes.isEmpty() || eventTypes.contains(eventType);
    }
}
