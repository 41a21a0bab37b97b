package com.tracechain.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mapping from an original source-ledger event to the transaction that relayed it to the target ledger.
 * Audit trail only: bridges keep their dedup state in memory.
 */
@Document(collection = "bridge_relays")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BridgeRelayRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String bridgeId;
    private String bridgeName;
    private LedgerId sourceChain;
    private LedgerId targetChain;
    @Indexed
    private String originalEventId;
    private String shipmentId;
    private String eventType;
    private String sourceTxHandle;
    private long sourceBlockReference;
    private String targetTxHandle;
    private Instant relayedAt;
}
