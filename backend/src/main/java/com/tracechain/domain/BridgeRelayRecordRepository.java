package com.tracechain.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for bridge_relays.
 */
public interface BridgeRelayRecordRepository extends MongoRepository<BridgeRelayRecord, String> {

    Optional<BridgeRelayRecord> findByBridgeId(String bridgeId);

    List<BridgeRelayRecord> findByBridgeNameAndOriginalEventId(String bridgeName, String originalEventId);
}
