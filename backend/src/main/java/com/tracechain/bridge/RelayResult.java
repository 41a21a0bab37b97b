package com.tracechain.bridge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tracechain.domain.LedgerId;

/**
 * Outcome of relaying one source event. {@code targetTxHandle} is set on success, {@code error} on failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelayResult(
        String originalEventId,
        String bridgeId,
        String shipmentId,
        LedgerId sourceChain,
        LedgerId targetChain,
        String targetTxHandle,
        Status status,
        String error
) {

    public enum Status {
        SUCCESS,
        ERROR
    }

    public static RelayResult success(String originalEventId, String bridgeId, String shipmentId,
                                      LedgerId sourceChain, LedgerId targetChain, String targetTxHandle) {
        return new RelayResult(originalEventId, bridgeId, shipmentId, sourceChain, targetChain, targetTxHandle,
                Status.SUCCESS, null);
    }

    public static RelayResult error(String originalEventId, String bridgeId, String shipmentId,
                                    LedgerId sourceChain, LedgerId targetChain, String error) {
        return new RelayResult(originalEventId, bridgeId, shipmentId, sourceChain, targetChain, null,
                Status.ERROR, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
