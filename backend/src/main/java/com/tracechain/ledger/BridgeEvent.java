package com.tracechain.ledger;

import java.time.Instant;

/**
 * Confirmed logistics event discovered in a source ledger's event log.
 *
 * @param originalEventId      event id as registered on the source ledger
 * @param shipmentId           shipment the event belongs to
 * @param eventType            event type as registered on the source ledger
 * @param sourceBlockReference block number (or height) that contains the event
 * @param sourceTxHandle       transaction / extrinsic that registered the event
 * @param discoveredAt         when the bridge fetched it
 */
public record BridgeEvent(
        String originalEventId,
        String shipmentId,
        String eventType,
        long sourceBlockReference,
        String sourceTxHandle,
        Instant discoveredAt
) {
}
