package com.tracechain.domain;

import java.util.Locale;

/**
 * Supported ledger identifier. The key is the lower-case name used in configuration, bridge names and relay metadata.
 */
public enum LedgerId {
    ETHEREUM("ethereum"),
    SUBSTRATE("substrate"),
    VIETNAMCHAIN("vietnamchain");

    private final String key;

    LedgerId(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Case-insensitive lookup by key or enum name.
     *
     * @throws IllegalArgumentException for unknown ledgers
     */
    public static LedgerId fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Ledger name is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LedgerId id : values()) {
            if (id.key.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unsupported ledger: " + value);
    }

    @Override
    public String toString() {
        return key;
    }
}
