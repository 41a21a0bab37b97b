package com.tracechain.ledger;

/**
 * Node or API unreachable, timed out or answered with a server error. Bridges retry on the next cycle.
 */
public class LedgerConnectivityException extends BlockchainException {

    public LedgerConnectivityException(String message) {
        super(message);
    }

    public LedgerConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
