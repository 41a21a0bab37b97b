package com.tracechain.bridge;

/**
 * No bridge is registered under the given name.
 */
public class UnknownBridgeException extends RuntimeException {

    public UnknownBridgeException(String name) {
        super("Bridge not found: " + name);
    }
}
