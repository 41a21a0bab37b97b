package com.tracechain.anchoring;

import com.tracechain.domain.EntityKind;

import java.util.Map;

/**
 * Fields of an off-chain record needed to anchor it.
 *
 * @param hashInput     fields committed by the data hash; serialised with sorted keys before hashing
 * @param documentHash  content hash of a document, which is anchored as is; null for shipments and events
 */
public record AnchorTarget(
        EntityKind entityKind,
        String entityId,
        String shipmentId,
        String trackingNumber,
        String eventType,
        String documentHash,
        Map<String, Object> hashInput
) {

    public AnchorTarget {
        hashInput = hashInput == null ? Map.of() : hashInput;
    }
}
