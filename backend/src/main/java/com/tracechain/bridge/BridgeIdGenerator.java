package com.tracechain.bridge;

import com.tracechain.common.Hashes;
import com.tracechain.domain.LedgerId;

import java.time.Clock;

/**
 * Builds {@code bridge_{source}_{hash16}} ids from the original event id, both ledgers and the current epoch second.
 * The time input makes a retry after a gap produce a new id, so the id labels a relay attempt and is not an
 * exactly-once key.
 */
public class BridgeIdGenerator {

    static final int HASH_LENGTH = 16;

    private final Clock clock;

    public BridgeIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String originalEventId, LedgerId source, LedgerId target) {
        long epochSecond = clock.instant().getEpochSecond();
        String digest = Hashes.sha256Hex(originalEventId, source.key(), target.key(), Long.toString(epochSecond));
        return "bridge_" + source.key() + "_" + digest.substring(0, HASH_LENGTH);
    }
}
