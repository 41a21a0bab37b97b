package com.tracechain.ledger.substrate;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Reads the dispatch outcome of one extrinsic from a block's encoded {@code System.Events} value.
 * <p>
 * Event bodies of other pallets cannot be sized without runtime metadata, so the value is scanned for an
 * {@code ApplyExtrinsic(index)} phase followed by {@code System.ExtrinsicSuccess} or {@code System.ExtrinsicFailed}.
 * A candidate counts only when its DispatchInfo (two-dimensional weight), its topics and the start of the next
 * record all decode.
 */
public final class SystemEvents {

    static final int SYSTEM_PALLET_INDEX = 0;
    static final int EXTRINSIC_SUCCESS = 0;
    static final int EXTRINSIC_FAILED = 1;

    private static final int PHASE_APPLY_EXTRINSIC = 0;
    private static final int PHASE_INITIALIZATION = 2;
    private static final String[] DISPATCH_ERRORS = {
            "Other", "CannotLookup", "BadOrigin", "Module", "ConsumerRemaining", "NoProviders",
            "TooManyConsumers", "Token", "Arithmetic", "Transactional", "Exhausted", "Corruption",
            "Unavailable", "RootNotAllowed", "Trie"
    };

    private static final String STORAGE_KEY = "0x" + HexFormat.of().formatHex(SubstrateHashing.twox128("System"))
            + HexFormat.of().formatHex(SubstrateHashing.twox128("Events"));

    private SystemEvents() {
    }

    public static String storageKey() {
        return STORAGE_KEY;
    }

    /**
     * @param success true for ExtrinsicSuccess
     * @param error   decoded DispatchError of a failed extrinsic, null on success
     */
    public record DispatchOutcome(boolean success, String error) {
    }

    /**
     * @return empty when no well-formed System outcome event for {@code extrinsicIndex} is present
     */
    public static Optional<DispatchOutcome> dispatchOutcome(byte[] events, int extrinsicIndex) {
        int start;
        try {
            ScaleReader header = new ScaleReader(events);
            if (header.readCompact() == 0) {
                return Optional.empty();
            }
            start = header.position();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        for (int offset = start; offset + 7 <= events.length; offset++) {
            if (!isOutcomeHeader(events, offset, extrinsicIndex)) {
                continue;
            }
            int variant = events[offset + 6] & 0xff;
            Optional<DispatchOutcome> outcome = readOutcome(Arrays.copyOfRange(events, offset + 7, events.length), variant);
            if (outcome.isPresent()) {
                return outcome;
            }
        }
        return Optional.empty();
    }

    private static boolean isOutcomeHeader(byte[] events, int offset, int extrinsicIndex) {
        if ((events[offset] & 0xff) != PHASE_APPLY_EXTRINSIC) {
            return false;
        }
        long index = 0;
        for (int i = 0; i < 4; i++) {
            index |= (long) (events[offset + 1 + i] & 0xff) << (8 * i);
        }
        int pallet = events[offset + 5] & 0xff;
        int variant = events[offset + 6] & 0xff;
        return index == extrinsicIndex && pallet == SYSTEM_PALLET_INDEX
                && (variant == EXTRINSIC_SUCCESS || variant == EXTRINSIC_FAILED);
    }

    private static Optional<DispatchOutcome> readOutcome(byte[] body, int variant) {
        try {
            ScaleReader reader = new ScaleReader(body);
            String error = variant == EXTRINSIC_FAILED ? readDispatchError(reader) : null;
            readDispatchInfo(reader);
            long topics = reader.readCompact();
            if (topics > reader.remaining() / 32) {
                return Optional.empty();
            }
            reader.readBytes((int) topics * 32);
            if (reader.remaining() > 0 && reader.readByte() > PHASE_INITIALIZATION) {
                return Optional.empty();
            }
            return Optional.of(new DispatchOutcome(variant == EXTRINSIC_SUCCESS, error));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static void readDispatchInfo(ScaleReader reader) {
        reader.readCompactBig();
        reader.readCompactBig();
        if (reader.readByte() > 2 || reader.readByte() > 1) {
            throw new IllegalArgumentException("Not a DispatchInfo");
        }
    }

    private static String readDispatchError(ScaleReader reader) {
        int kind = reader.readByte();
        if (kind >= DISPATCH_ERRORS.length) {
            throw new IllegalArgumentException("Unknown DispatchError variant " + kind);
        }
        String name = DISPATCH_ERRORS[kind];
        switch (name) {
            case "Module":
                int pallet = reader.readByte();
                byte[] error = reader.readBytes(4);
                return "Module(index=" + pallet + ", error=" + (error[0] & 0xff) + ")";
            case "Token":
            case "Arithmetic":
            case "Transactional":
            case "Trie":
                return name + "(" + reader.readByte() + ")";
            default:
                return name;
        }
    }
}
