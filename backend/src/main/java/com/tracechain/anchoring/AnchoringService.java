package com.tracechain.anchoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tracechain.common.Hashes;
import com.tracechain.domain.AnchorRecord;
import com.tracechain.domain.AnchorRecordRepository;
import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import com.tracechain.domain.UnifiedTransactionStatus;
import com.tracechain.ledger.AnchorRequest;
import com.tracechain.ledger.LedgerClient;
import com.tracechain.ledger.LedgerClientRegistry;
import com.tracechain.ledger.TransactionStatusReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Anchors shipments, events and documents on a ledger and tracks the resulting transaction status.
 *
 * <p>Shipment and event hashes are SHA-256 over the record's fields serialised as JSON with sorted keys; a
 * document is anchored by its stored content hash.
 */
@Service
@Slf4j
public class AnchoringService {

    private final AnchorTargetLookup targetLookup;
    private final AnchorRecordRepository anchorRecordRepository;
    private final AnchorResultRecorder resultRecorder;
    private final LedgerClientRegistry ledgerClients;
    private final ObjectMapper canonicalMapper;
    private final Clock clock;

    public AnchoringService(AnchorTargetLookup targetLookup, AnchorRecordRepository anchorRecordRepository,
                            AnchorResultRecorder resultRecorder, LedgerClientRegistry ledgerClients,
                            ObjectMapper objectMapper, Clock clock) {
        this.targetLookup = targetLookup;
        this.anchorRecordRepository = anchorRecordRepository;
        this.resultRecorder = resultRecorder;
        this.ledgerClients = ledgerClients;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    /**
     * Submits the record's hash and stores the handle as PENDING.
     *
     * @throws AnchorTargetNotFoundException when the record does not exist
     * @throws com.tracechain.ledger.BlockchainException when the ledger is not configured or rejects the call
     */
    public AnchorOutcome anchor(EntityKind entityKind, String entityId, LedgerId ledger) {
        LedgerClient client = ledgerClients.require(ledger);
        AnchorTarget target = targetLookup.lookup(entityKind, entityId)
                .orElseThrow(() -> new AnchorTargetNotFoundException(entityKind, entityId));
        String metadata = toJson(target);
        String dataHash = entityKind == EntityKind.DOCUMENT ? target.documentHash() : Hashes.sha256Hex(metadata);
        AnchorRequest request = new AnchorRequest(entityKind, target.entityId(), target.shipmentId(),
                target.trackingNumber(), target.eventType(), dataHash, target.hashInput());
        String txHandle = client.anchor(request, metadata);
        resultRecorder.record(entityKind, target.entityId(), txHandle, ledger, UnifiedTransactionStatus.PENDING);
        log.info("Anchored {} {} on {}: {}", entityKind.key(), target.entityId(), ledger, txHandle);
        return new AnchorOutcome(entityKind, target.entityId(), ledger, txHandle, UnifiedTransactionStatus.PENDING,
                dataHash, clock.instant());
    }

    public List<AnchorRecord> findAnchors(EntityKind entityKind, String entityId) {
        return anchorRecordRepository.findByEntityKindAndEntityId(entityKind, entityId);
    }

    public TransactionStatusReport transactionStatus(LedgerId ledger, String txHandle) {
        return ledgerClients.require(ledger).getTransactionStatus(txHandle);
    }

    /**
     * Polls the ledger for a stored anchor and records the result. Returns null when the ledger is not enabled.
     */
    public TransactionStatusReport refreshStatus(AnchorRecord record) {
        LedgerClient client = ledgerClients.find(record.getLedger()).orElse(null);
        if (client == null || record.getTxHandle() == null) {
            return null;
        }
        TransactionStatusReport report = client.getTransactionStatus(record.getTxHandle());
        if (report.status() != record.getStatus()) {
            log.info("Anchor {} {} on {}: {} -> {}", record.getEntityKind().key(), record.getEntityId(),
                    record.getLedger(), record.getStatus(), report.status());
        }
        resultRecorder.recordStatus(record.getEntityKind(), record.getEntityId(), report);
        return report;
    }

    private String toJson(AnchorTarget target) {
        try {
            return canonicalMapper.writeValueAsString(target.hashInput());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise " + target.entityKind().key() + " " + target.entityId(), e);
        }
    }
}
