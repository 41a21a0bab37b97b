package com.tracechain.ledger;

/**
 * The ledger answered but refused the request: JSON-RPC error, reverted/invalid transaction, 4xx response,
 * or a response without a transaction id. Not retried automatically.
 */
public class LedgerRejectionException extends BlockchainException {

    public LedgerRejectionException(String message) {
        super(message);
    }

    public LedgerRejectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
