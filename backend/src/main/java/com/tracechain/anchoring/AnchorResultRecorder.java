package com.tracechain.anchoring;

import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import com.tracechain.domain.UnifiedTransactionStatus;
import com.tracechain.ledger.TransactionStatusReport;

/**
 * Idempotent upsert of anchoring state per (entity, ledger). Repeating a call with the same arguments leaves the
 * same record.
 */
public interface AnchorResultRecorder {

    void record(EntityKind entityKind, String entityId, String txHandle, LedgerId ledger, UnifiedTransactionStatus status);

    /** Applies a polled status (block, confirmations, error) to an existing anchor. */
    void recordStatus(EntityKind entityKind, String entityId, TransactionStatusReport report);
}
