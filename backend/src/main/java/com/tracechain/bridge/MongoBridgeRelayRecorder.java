package com.tracechain.bridge;

import com.tracechain.domain.BridgeRelayRecord;
import com.tracechain.domain.BridgeRelayRecordRepository;
import com.tracechain.ledger.BridgeEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Stores successful relays in bridge_relays.
 */
@Component
@RequiredArgsConstructor
public class MongoBridgeRelayRecorder implements BridgeRelayRecorder {

    private final BridgeRelayRecordRepository repository;
    private final Clock clock;

    @Override
    public void recordRelay(String bridgeName, BridgeEvent event, RelayResult result) {
        BridgeRelayRecord record = new BridgeRelayRecord();
        record.setBridgeId(result.bridgeId());
        record.setBridgeName(bridgeName);
        record.setSourceChain(result.sourceChain());
        record.setTargetChain(result.targetChain());
        record.setOriginalEventId(event.originalEventId());
        record.setShipmentId(event.shipmentId());
        record.setEventType(event.eventType());
        record.setSourceTxHandle(event.sourceTxHandle());
        record.setSourceBlockReference(event.sourceBlockReference());
        record.setTargetTxHandle(result.targetTxHandle());
        record.setRelayedAt(clock.instant());
        repository.save(record);
    }

    @Override
    public Optional<BridgeRelayRecord> findByBridgeId(String bridgeId) {
        return repository.findByBridgeId(bridgeId);
    }
}
