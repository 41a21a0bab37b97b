package com.tracechain.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracechain.common.Hashes;
import com.tracechain.domain.BridgeRelayRecord;
import com.tracechain.ledger.BridgeEvent;
import com.tracechain.ledger.LedgerClient;
import com.tracechain.ledger.VerificationResult;
import com.tracechain.oracle.Oracle;
import com.tracechain.oracle.OracleStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relays confirmed events from a source ledger to a target ledger.
 *
 * <p>Each cycle reads events in {@code (cursor, head - confirmationBlocks]} from the source, skips ids already in
 * the {@link ProcessedEventSet}, and registers each remaining event on the target under a fresh bridge id with
 * the event type prefixed {@value #BRIDGED_PREFIX}. The cursor advances to the gated upper bound even when no
 * events were found and never moves backwards. A failed relay is reported in the batch result and does not stop
 * the rest of the batch.
 */
@Slf4j
public class ChainBridge extends Oracle<BridgeEventBatch, BridgeBatchResult> {

    public static final String BRIDGED_PREFIX = "BRIDGED_";

    private final BridgeSettings settings;
    private final LedgerClient source;
    private final LedgerClient target;
    private final BridgeIdGenerator bridgeIdGenerator;
    private final BridgeRelayRecorder relayRecorder;
    private final ObjectMapper objectMapper;
    private final ProcessedEventSet processedEvents;

    private volatile Long lastProcessedBlock;

    public ChainBridge(BridgeSettings settings, LedgerClient source, LedgerClient target,
                       BridgeIdGenerator bridgeIdGenerator, BridgeRelayRecorder relayRecorder,
                       ObjectMapper objectMapper, ProcessedEventSet processedEvents, Clock clock) {
        super(settings.name(), settings.pollInterval(), clock);
        if (source.ledgerId() != settings.source() || target.ledgerId() != settings.target()) {
            throw new IllegalArgumentException("Ledger clients do not match bridge " + settings.name());
        }
        this.settings = settings;
        this.source = source;
        this.target = target;
        this.bridgeIdGenerator = bridgeIdGenerator;
        this.relayRecorder = relayRecorder;
        this.objectMapper = objectMapper;
        this.processedEvents = processedEvents;
    }

    @Override
    protected BridgeEventBatch fetchData() {
        long head = source.currentHead();
        long upper = head - settings.confirmationBlocks();
        Long cursor = lastProcessedBlock;
        long lower = cursor != null ? cursor : Math.max(0, head - settings.lookbackBlocks());
        if (lower >= upper) {
            log.debug("Bridge {}: nothing confirmed past block {} (head {})", getName(), lower, head);
            return BridgeEventBatch.empty(head, lower, upper);
        }
        List<BridgeEvent> confirmed = new ArrayList<>();
        for (BridgeEvent event : source.fetchEvents(lower, upper)) {
            if (event.sourceBlockReference() > upper) {
                log.warn("Bridge {}: dropping event {} at block {} beyond confirmed block {}",
                        getName(), event.originalEventId(), event.sourceBlockReference(), upper);
                continue;
            }
            if (!settings.accepts(event.eventType())) {
                continue;
            }
            confirmed.add(event);
        }
        advanceCursor(upper);
        if (!confirmed.isEmpty()) {
            log.info("Bridge {}: {} event(s) in blocks ({}, {}]", getName(), confirmed.size(), lower, upper);
        }
        return new BridgeEventBatch(head, lower, upper, confirmed);
    }

    @Override
    protected BridgeBatchResult processData(BridgeEventBatch batch) {
        List<RelayResult> results = new ArrayList<>();
        for (BridgeEvent event : batch.events()) {
            if (processedEvents.contains(event.originalEventId())) {
                log.debug("Bridge {}: event {} already relayed", getName(), event.originalEventId());
                continue;
            }
            results.add(relay(event));
        }
        int evicted = processedEvents.trimIfNeeded();
        if (evicted > 0) {
            log.info("Bridge {}: evicted {} oldest processed event id(s), {} kept", getName(), evicted,
                    processedEvents.size());
        }
        return new BridgeBatchResult(results.size(), results, clock.instant());
    }

    private RelayResult relay(BridgeEvent event) {
        String bridgeId = null;
        try {
            bridgeId = bridgeIdGenerator.generate(event.originalEventId(), settings.source(), settings.target());
            String metadata = provenanceMetadata(event, bridgeId);
            String dataHash = Hashes.sha256Hex(event.shipmentId(), event.originalEventId(), event.eventType(), bridgeId);
            String txHandle = target.registerEvent(event.shipmentId(), bridgeId, BRIDGED_PREFIX + event.eventType(),
                    dataHash, metadata);
            processedEvents.add(event.originalEventId());
            RelayResult result = RelayResult.success(event.originalEventId(), bridgeId, event.shipmentId(),
                    settings.source(), settings.target(), txHandle);
            log.info("Bridge {}: relayed event {} as {} (tx {})", getName(), event.originalEventId(), bridgeId, txHandle);
            recordRelay(event, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Bridge {}: failed to relay event {}: {}", getName(), event.originalEventId(), e.getMessage());
            return RelayResult.error(event.originalEventId(), bridgeId, event.shipmentId(),
                    settings.source(), settings.target(), e.getMessage());
        }
    }

    private void recordRelay(BridgeEvent event, RelayResult result) {
        try {
            relayRecorder.recordRelay(getName(), event, result);
        } catch (RuntimeException e) {
            log.warn("Bridge {}: relay of {} succeeded but could not be recorded: {}", getName(),
                    event.originalEventId(), e.getMessage());
        }
    }

    private String provenanceMetadata(BridgeEvent event, String bridgeId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source_chain", settings.source().key());
        metadata.put("source_tx_hash", event.sourceTxHandle());
        metadata.put("source_block", event.sourceBlockReference());
        metadata.put("bridge_id", bridgeId);
        metadata.put("original_event_id", event.originalEventId());
        metadata.put("bridged_at", clock.instant().toString());
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise relay metadata", e);
        }
    }

    private synchronized void advanceCursor(long upper) {
        if (lastProcessedBlock == null || upper > lastProcessedBlock) {
            lastProcessedBlock = upper;
        }
    }

    /**
     * Checks the original event on the source and the relayed event on the target. Uses the shipment id of the
     * recorded relay when one exists, otherwise checks presence only. Query failures are reported, not thrown.
     */
    public BridgeVerification verifyBridgedEvent(String bridgeId, String originalEventId) {
        try {
            String shipmentId = relayRecorder.findByBridgeId(bridgeId)
                    .map(BridgeRelayRecord::getShipmentId)
                    .orElse(null);
            VerificationResult sourceResult = source.verifyEvent(shipmentId, originalEventId);
            VerificationResult targetResult = target.verifyEvent(shipmentId, bridgeId);
            return BridgeVerification.of(bridgeId, originalEventId, settings.source(), settings.target(),
                    sourceResult, targetResult);
        } catch (RuntimeException e) {
            log.warn("Bridge {}: verification of {} failed: {}", getName(), bridgeId, e.getMessage());
            return BridgeVerification.failed(bridgeId, originalEventId, settings.source(), settings.target(),
                    e.getMessage());
        }
    }

    public BridgeStatus describe(boolean running) {
        OracleStatus status = getStatus();
        return new BridgeStatus(getName(), settings.source(), settings.target(), running, status.lastRun(),
                status.intervalSeconds(), settings.confirmationBlocks(), settings.eventTypes(), lastProcessedBlock,
                processedEvents.size(), status.consecutiveFailures(), status.lastError());
    }

    public BridgeSettings getSettings() {
        return settings;
    }

    /** Last gated upper bound scanned, or null before the first successful fetch. */
    public Long getLastProcessedBlock() {
        return lastProcessedBlock;
    }

    public ProcessedEventSet getProcessedEvents() {
        return processedEvents;
    }
}
