package com.tracechain.anchoring.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Anchoring collaborators: record lookup bound and status polling.
 */
@ConfigurationProperties(prefix = "tracechain.anchoring")
@NoArgsConstructor
@Getter
@Setter
public class AnchoringProperties {

    /** Server-side time limit for one record lookup. */
    private long lookupTimeoutMs = 5_000L;

    /** How often (ms) non-terminal anchors are re-polled. */
    private long statusPollIntervalMs = 60_000L;

    /** Anchors older than this stop being polled and stay in their last status. */
    private long statusPollMaxAgeHours = 72;

    private Collections collections = new Collections();

    /** Collections of the CRUD layer holding the anchored records. */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Collections {
        private String shipments = "shipments";
        private String events = "shipment_events";
        private String documents = "documents";
    }
}
