package com.tracechain.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a read-only verification against a ledger. A mismatch or a missing record is
 * {@code verified=false} with a reason; connectivity and protocol failures are thrown instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResult(boolean verified, String reason, Map<String, Object> details) {

    public VerificationResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static VerificationResult verified(Map<String, Object> details) {
        return new VerificationResult(true, null, details);
    }

    public static VerificationResult rejected(String reason, Map<String, Object> details) {
        return new VerificationResult(false, reason, details);
    }

    public static VerificationResult notFound(String what, Map<String, Object> details) {
        return new VerificationResult(false, what + " not found on blockchain", details);
    }
}
