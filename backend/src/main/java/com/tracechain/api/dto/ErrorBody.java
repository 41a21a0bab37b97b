package com.tracechain.api.dto;

import java.time.Instant;

/**
 * Error response of the admin API. {@code error} is one of the codes below (or a field-specific code
 * from a validation message), {@code timestamp} is ISO 8601 UTC.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String CONFLICT = "CONFLICT";
    /** Ledger client disabled or missing a key / contract address. */
    public static final String LEDGER_NOT_CONFIGURED = "LEDGER_NOT_CONFIGURED";
    public static final String LEDGER_UNAVAILABLE = "LEDGER_UNAVAILABLE";
    public static final String LEDGER_REJECTED = "LEDGER_REJECTED";

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
