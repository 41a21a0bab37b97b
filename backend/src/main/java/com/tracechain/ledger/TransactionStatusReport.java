package com.tracechain.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import com.tracechain.domain.UnifiedTransactionStatus;

/**
 * Ledger-neutral view of a transaction. Optional fields are null when the ledger does not report them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionStatusReport(
        LedgerId ledger,
        String txHandle,
        UnifiedTransactionStatus status,
        Long blockReference,
        Long confirmations,
        EntityKind entityKind,
        String entityId,
        String error
) {

    public static TransactionStatusReport pending(LedgerId ledger, String txHandle) {
        return new TransactionStatusReport(ledger, txHandle, UnifiedTransactionStatus.PENDING, null, 0L, null, null, null);
    }

    public static TransactionStatusReport notFound(LedgerId ledger, String txHandle) {
        return new TransactionStatusReport(ledger, txHandle, UnifiedTransactionStatus.NOT_FOUND, null, null, null, null,
                "Transaction not found");
    }

    public static TransactionStatusReport error(LedgerId ledger, String txHandle, String error) {
        return new TransactionStatusReport(ledger, txHandle, UnifiedTransactionStatus.ERROR, null, null, null, null, error);
    }
}
