package com.tracechain.domain;

/**
 * Ledger-neutral transaction status. Every ledger client maps its native status vocabulary onto this set;
 * native values without a mapping become {@link #ERROR}.
 */
public enum UnifiedTransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED,
    NOT_FOUND,
    ERROR;

    /** Terminal statuses are not polled again by the anchor status job. */
    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED;
    }
}
