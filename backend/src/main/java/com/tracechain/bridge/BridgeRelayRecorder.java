package com.tracechain.bridge;

import com.tracechain.domain.BridgeRelayRecord;
import com.tracechain.ledger.BridgeEvent;

import java.util.Optional;

/**
 * Audit trail of relays: original event → bridge id → target transaction.
 */
public interface BridgeRelayRecorder {

    void recordRelay(String bridgeName, BridgeEvent event, RelayResult result);

    Optional<BridgeRelayRecord> findByBridgeId(String bridgeId);
}
