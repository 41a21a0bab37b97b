package com.tracechain.ledger;

import com.tracechain.domain.EntityKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One anchoring call: the record identity, its linkage and the digest to commit. Built per call, never persisted.
 *
 * @param entityKind     shipment, event or document
 * @param entityId       id of the anchored record (document id for documents)
 * @param shipmentId     owning shipment (same as entityId for shipments, may be null for documents)
 * @param trackingNumber shipment tracking number, shipments only
 * @param eventType      event type, events only
 * @param dataHash       hex SHA-256 digest of the record's canonical form
 * @param metadata       JSON-serialisable extra data stored next to the hash
 */
public record AnchorRequest(
        EntityKind entityKind,
        String entityId,
        String shipmentId,
        String trackingNumber,
        String eventType,
        String dataHash,
        Map<String, Object> metadata
) {

    public AnchorRequest {
        if (entityKind == null) {
            throw new IllegalArgumentException("entityKind is required");
        }
        if (dataHash == null || dataHash.isBlank()) {
            throw new IllegalArgumentException("dataHash is required");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
