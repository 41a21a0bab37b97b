package com.tracechain.api.dto;

/**
 * Result of start/stop/remove. {@code changed} is false when the call was a no-op (already running, not running).
 */
public record BridgeActionResponse(String name, boolean changed, boolean running) {
}
