package com.tracechain.bridge.config;

import com.tracechain.bridge.BridgeSettings;
import com.tracechain.domain.LedgerId;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Bridges created at startup. Each definition builds one bridge, or a pair when {@code two-way} is set.
 */
@ConfigurationProperties(prefix = "tracechain.bridge")
@NoArgsConstructor
@Getter
@Setter
public class BridgeProperties {

    /** When false no bridge is created at startup (the admin API can still add bridges). */
    private boolean enabled = true;

    /** Start configured bridges once the application is ready. */
    private boolean autoStart = true;

    private List<Definition> definitions = new ArrayList<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Definition {

        /** Ledger key: ethereum, substrate or vietnamchain. */
        private String source;
        private String target;
        /** Empty relays every event type. */
        private List<String> eventTypes = new ArrayList<>();
        private int confirmationBlocks = BridgeSettings.DEFAULT_CONFIRMATION_BLOCKS;
        private long pollIntervalSeconds = BridgeSettings.DEFAULT_POLL_INTERVAL.toSeconds();
        private long lookbackBlocks = BridgeSettings.DEFAULT_LOOKBACK_BLOCKS;
        private boolean twoWay;

        public BridgeSettings toSettings() {
            return new BridgeSettings(
                    LedgerId.fromKey(source),
                    LedgerId.fromKey(target),
                    new HashSet<>(eventTypes),
                    confirmationBlocks,
                    Duration.ofSeconds(pollIntervalSeconds),
                    lookbackBlocks);
        }
    }
}
