package com.tracechain.anchoring;

import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import com.tracechain.domain.UnifiedTransactionStatus;

import java.time.Instant;

/**
 * Result of submitting an anchor: the handle to poll and the hash that was committed.
 */
public record AnchorOutcome(
        EntityKind entityKind,
        String entityId,
        LedgerId ledger,
        String txHandle,
        UnifiedTransactionStatus status,
        String dataHash,
        Instant submittedAt
) {
}
