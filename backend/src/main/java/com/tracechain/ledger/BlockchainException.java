package com.tracechain.ledger;

/**
 * Base of all ledger interaction failures. Register calls either return a transaction handle or throw a subtype of this.
 */
public class BlockchainException extends RuntimeException {

    public BlockchainException(String message) {
        super(message);
    }

    public BlockchainException(String message, Throwable cause) {
        super(message, cause);
    }
}
