package com.tracechain.ledger;

import com.tracechain.domain.LedgerId;

/**
 * Uniform anchoring and verification primitives over one ledger family.
 *
 * <p>Register calls return the ledger's transaction handle (opaque to callers) or throw a
 * {@link BlockchainException}; they never return a partial result. {@link #getTransactionStatus(String)} reports
 * unknown handles as NOT_FOUND instead of throwing. Verify calls are read-only.
 */
public interface LedgerClient extends LedgerEventSource {

    LedgerId ledgerId();

    String registerShipment(String shipmentId, String trackingNumber, String dataHash, String metadataJson);

    String registerEvent(String shipmentId, String eventId, String eventType, String dataHash, String metadataJson);

    String registerDocument(String documentHash, String metadataJson);

    TransactionStatusReport getTransactionStatus(String txHandle);

    VerificationResult verifyShipment(String shipmentId, String trackingNumber);

    /**
     * Verifies the event exists and belongs to the shipment. A null or blank shipmentId checks presence only.
     */
    VerificationResult verifyEvent(String shipmentId, String eventId);

    VerificationResult verifyDocument(String documentHash);

    /**
     * Dispatches an anchor request to the matching register call.
     */
    default String anchor(AnchorRequest request, String metadataJson) {
        return switch (request.entityKind()) {
            case SHIPMENT -> registerShipment(request.entityId(), request.trackingNumber(), request.dataHash(), metadataJson);
            case EVENT -> registerEvent(request.shipmentId(), request.entityId(), request.eventType(), request.dataHash(), metadataJson);
            case DOCUMENT -> registerDocument(request.dataHash(), metadataJson);
        };
    }
}
