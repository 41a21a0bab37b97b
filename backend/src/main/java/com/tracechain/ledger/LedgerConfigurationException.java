package com.tracechain.ledger;

/**
 * A required client, key or contract address is not configured.
 */
public class LedgerConfigurationException extends BlockchainException {

    public LedgerConfigurationException(String message) {
        super(message);
    }

    public LedgerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
