package com.tracechain.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for anchor_records. Writes go through MongoAnchorResultRecorder (upsert); reads are used by the API and poll job.
 */
public interface AnchorRecordRepository extends MongoRepository<AnchorRecord, String> {

    Optional<AnchorRecord> findByEntityKindAndEntityIdAndLedger(EntityKind entityKind, String entityId, LedgerId ledger);

    List<AnchorRecord> findByEntityKindAndEntityId(EntityKind entityKind, String entityId);

    /** Non-terminal records (PENDING, NOT_FOUND, ERROR) for the status poll job. */
    List<AnchorRecord> findByStatusIn(Collection<UnifiedTransactionStatus> statuses);
}
