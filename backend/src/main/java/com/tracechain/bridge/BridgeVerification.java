package com.tracechain.bridge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tracechain.domain.LedgerId;
import com.tracechain.ledger.VerificationResult;

/**
 * Presence check of a relayed event on both ledgers. {@code verified} requires both sides; {@code error} is set
 * when a ledger could not be queried.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeVerification(
        String bridgeId,
        String originalEventId,
        LedgerId sourceChain,
        LedgerId targetChain,
        boolean sourceVerified,
        boolean targetVerified,
        boolean verified,
        VerificationResult sourceDetails,
        VerificationResult targetDetails,
        String error
) {

    public static BridgeVerification of(String bridgeId, String originalEventId, LedgerId sourceChain,
                                         LedgerId targetChain, VerificationResult source, VerificationResult target) {
        return new BridgeVerification(bridgeId, originalEventId, sourceChain, targetChain,
                source.verified(), target.verified(), source.verified() && target.verified(),
                source, target, null);
    }

    public static BridgeVerification failed(String bridgeId, String originalEventId, LedgerId sourceChain,
                                            LedgerId targetChain, String error) {
        return new BridgeVerification(bridgeId, originalEventId, sourceChain, targetChain,
                false, false, false, null, null, error);
    }
}
