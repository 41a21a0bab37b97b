package com.tracechain.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Anchoring status per (entityKind, entityId, ledger). Upserted by the anchoring service and the status poll job.
 */
@Document(collection = "anchor_records")
@CompoundIndex(name = "entity_ledger", def = "{'entityKind': 1, 'entityId': 1, 'ledger': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AnchorRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private EntityKind entityKind;
    private String entityId;
    private LedgerId ledger;
    private String txHandle;
    private UnifiedTransactionStatus status;
    private Long blockReference;
    private Long confirmations;
    private String lastError;
    private Instant createdAt;
    /** When the current {@code txHandle} was submitted; reset on every re-anchor. */
    private Instant submittedAt;
    private Instant updatedAt;
}
