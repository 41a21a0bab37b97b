package com.tracechain.domain;

import java.util.Locale;

/**
 * Kind of off-chain record whose hash is anchored on a ledger.
 */
public enum EntityKind {
    SHIPMENT,
    EVENT,
    DOCUMENT;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive; returns null for null/blank or unknown values. */
    public static EntityKind fromKeyOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
