package com.tracechain.ledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-ledger client configuration. A ledger gets a client only when {@code enabled} is true; secrets come from the
 * environment and are never logged.
 */
@ConfigurationProperties(prefix = "tracechain.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** Per-request HTTP timeout for all ledger clients. */
    private long requestTimeoutMs = 30_000L;

    private Ethereum ethereum = new Ethereum();
    private Substrate substrate = new Substrate();
    private VietnamChain vietnamchain = new VietnamChain();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Ethereum {

        private boolean enabled;
        private List<String> urls = new ArrayList<>();
        private String privateKey;
        private long chainId = 1L;
        private String shipmentRegistryAddress;
        private String eventLogAddress;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Substrate {

        private boolean enabled;
        private List<String> urls = new ArrayList<>();
        private String mnemonic;
        private String mnemonicPassword = "";
        private String palletName = "LogisticsTraceability";
        private int palletIndex = 8;
        private int registerShipmentCallIndex = 0;
        private int registerEventCallIndex = 1;
        private int registerDocumentCallIndex = 2;
        /** Set when the runtime includes the CheckMetadataHash signed extension. */
        private boolean metadataHashExtension;
        private int ss58Prefix = 42;
        private boolean waitForInclusion = true;
        private long inclusionTimeoutMs = 60_000L;
        private long blockPollIntervalMs = 2_000L;
        /** Recent blocks searched by a status lookup. */
        private int statusScanDepth = 50;
        private int documentScanPageSize = 100;
        private int documentScanMaxKeys = 10_000;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class VietnamChain {

        private boolean enabled;
        private List<String> urls = new ArrayList<>();
        private String apiKey;
        private String apiSecret;
        private String organizationId;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
