package com.tracechain.ledger.substrate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import com.tracechain.domain.UnifiedTransactionStatus;
import com.tracechain.ledger.BlockchainException;
import com.tracechain.ledger.BridgeEvent;
import com.tracechain.ledger.JsonRpcSupport;
import com.tracechain.ledger.LedgerClient;
import com.tracechain.ledger.LedgerConnectivityException;
import com.tracechain.ledger.LedgerRejectionException;
import com.tracechain.ledger.RpcEndpointRotator;
import com.tracechain.ledger.TransactionStatusReport;
import com.tracechain.ledger.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Ledger client for Substrate chains running the LogisticsTraceability pallet. Extrinsics are built and signed
 * locally (see {@link ExtrinsicCodec}); reads go to pallet storage. Runtime version and genesis hash are cached.
 */
@Slf4j
public class SubstrateLedgerClient implements LedgerClient {

    private final SubstrateRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final ObjectMapper objectMapper;
    private final SubstrateKeypair keypair;
    private final SubstrateSettings settings;
    private final LogisticsPallet pallet;
    private final Cache runtimeCache;
    private final Clock clock;
    private final String accountAddress;

    public SubstrateLedgerClient(SubstrateRpcClient rpcClient,
                                 RpcEndpointRotator rotator,
                                 ObjectMapper objectMapper,
                                 SubstrateKeypair keypair,
                                 SubstrateSettings settings,
                                 Cache runtimeCache,
                                 Clock clock) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.objectMapper = objectMapper;
        this.keypair = keypair;
        this.settings = settings;
        this.pallet = new LogisticsPallet(settings);
        this.runtimeCache = runtimeCache;
        this.clock = clock;
        this.accountAddress = keypair.ss58Address(settings.ss58Prefix());
        log.info("Substrate ledger client ready: pallet={}, account={}", settings.palletName(), accountAddress);
    }

    @Override
    public LedgerId ledgerId() {
        return LedgerId.SUBSTRATE;
    }

    public String getAccountAddress() {
        return accountAddress;
    }

    @Override
    public String registerShipment(String shipmentId, String trackingNumber, String dataHash, String metadataJson) {
        String hash = submit(pallet.registerShipmentCall(shipmentId, trackingNumber, dataHash, metadataJson));
        log.info("Shipment {} submitted to Substrate: {}", shipmentId, hash);
        return hash;
    }

    @Override
    public String registerEvent(String shipmentId, String eventId, String eventType, String dataHash, String metadataJson) {
        String hash = submit(pallet.registerEventCall(shipmentId, eventId, eventType, dataHash, metadataJson));
        log.info("Event {} ({}) submitted to Substrate: {}", eventId, eventType, hash);
        return hash;
    }

    @Override
    public String registerDocument(String documentHash, String metadataJson) {
        String documentId = UUID.randomUUID().toString();
        String hash = submit(pallet.registerDocumentCall(documentId, documentHash, metadataJson));
        log.info("Document {} submitted to Substrate: {}", documentId, hash);
        return hash;
    }

    /**
     * Searches the last {@code statusScanDepth} blocks, then the pending pool. An included extrinsic is CONFIRMED or
     * FAILED according to its System outcome event in that block; an outcome that cannot be read is an ERROR.
     */
    @Override
    public TransactionStatusReport getTransactionStatus(String txHandle) {
        try {
            long head = currentHead();
            long lowest = Math.max(0, head - settings.statusScanDepth() + 1);
            for (long number = head; number >= lowest; number--) {
                BlockBody block = block(number);
                for (int index = 0; index < block.extrinsics().size(); index++) {
                    byte[] extrinsic = block.extrinsics().get(index);
                    if (ExtrinsicCodec.hash(extrinsic).equalsIgnoreCase(txHandle)) {
                        return includedStatus(txHandle, block, index, number, head - number);
                    }
                }
            }
            for (JsonNode pending : rpc("author_pendingExtrinsics", List.of())) {
                if (ExtrinsicCodec.hash(fromHex(pending.asText())).equalsIgnoreCase(txHandle)) {
                    return TransactionStatusReport.pending(ledgerId(), txHandle);
                }
            }
            return TransactionStatusReport.notFound(ledgerId(), txHandle);
        } catch (BlockchainException e) {
            log.warn("Status lookup for {} failed: {}", txHandle, e.getMessage());
            return TransactionStatusReport.error(ledgerId(), txHandle, e.getMessage());
        }
    }

    private TransactionStatusReport includedStatus(String txHandle, BlockBody block, int index, long number, long confirmations) {
        Optional<LogisticsPallet.DecodedCall> call = decodePalletCall(block.extrinsics().get(index));
        EntityKind kind = call.map(LogisticsPallet.DecodedCall::kind).orElse(null);
        String entityId = call.map(LogisticsPallet.DecodedCall::entityId).orElse(null);
        Optional<SystemEvents.DispatchOutcome> outcome = storageAt(SystemEvents.storageKey(), block.hash())
                .flatMap(events -> SystemEvents.dispatchOutcome(events, index));
        if (outcome.isEmpty()) {
            log.warn("No dispatch outcome for {} (extrinsic {} of block {})", txHandle, index, number);
            return new TransactionStatusReport(ledgerId(), txHandle, UnifiedTransactionStatus.ERROR, number, confirmations,
                    kind, entityId, "Undecodable System.Events for extrinsic " + index + " of block " + number);
        }
        if (!outcome.get().success()) {
            return new TransactionStatusReport(ledgerId(), txHandle, UnifiedTransactionStatus.FAILED, number, confirmations,
                    kind, entityId, "Dispatch failed: " + outcome.get().error());
        }
        return new TransactionStatusReport(ledgerId(), txHandle, UnifiedTransactionStatus.CONFIRMED, number, confirmations,
                kind, entityId, null);
    }

    @Override
    public VerificationResult verifyShipment(String shipmentId, String trackingNumber) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("shipmentId", shipmentId);
        Optional<byte[]> value = storage(pallet.storageKey(LogisticsPallet.SHIPMENTS, shipmentId));
        if (value.isEmpty()) {
            return VerificationResult.notFound("Shipment", details);
        }
        LogisticsPallet.StoredShipment shipment = decode(() -> pallet.decodeShipment(value.get()), LogisticsPallet.SHIPMENTS);
        details.put("trackingNumber", shipment.trackingNumber());
        details.put("dataHash", shipment.dataHash());
        details.put("timestamp", shipment.timestamp());
        details.put("metadata", shipment.metadata());
        details.put("registrar", shipment.registrar());
        if (trackingNumber != null && !trackingNumber.isBlank() && !trackingNumber.equals(shipment.trackingNumber())) {
            return VerificationResult.rejected("Tracking number mismatch (stored: " + shipment.trackingNumber() + ")", details);
        }
        return VerificationResult.verified(details);
    }

    @Override
    public VerificationResult verifyEvent(String shipmentId, String eventId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventId", eventId);
        Optional<byte[]> value = storage(pallet.storageKey(LogisticsPallet.EVENTS, eventId));
        if (value.isEmpty()) {
            return VerificationResult.notFound("Event", details);
        }
        LogisticsPallet.StoredEvent event = decode(() -> pallet.decodeEvent(value.get()), LogisticsPallet.EVENTS);
        details.put("shipmentId", event.shipmentId());
        details.put("eventType", event.eventType());
        details.put("dataHash", event.dataHash());
        details.put("timestamp", event.timestamp());
        details.put("metadata", event.metadata());
        details.put("registrar", event.registrar());
        if (shipmentId != null && !shipmentId.isBlank() && !shipmentId.equals(event.shipmentId())) {
            return VerificationResult.rejected("Shipment ID mismatch (stored: " + event.shipmentId() + ")", details);
        }
        return VerificationResult.verified(details);
    }

    /**
     * Documents are keyed by id, so lookup by hash pages through the Documents map (bounded by
     * {@code documentScanMaxKeys}).
     */
    @Override
    public VerificationResult verifyDocument(String documentHash) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("documentHash", documentHash);
        String prefix = pallet.storagePrefix(LogisticsPallet.DOCUMENTS);
        String startKey = null;
        int scanned = 0;
        while (scanned < settings.documentScanMaxKeys()) {
            List<Object> params = new ArrayList<>(List.of(prefix, settings.documentScanPageSize()));
            if (startKey != null) {
                params.add(startKey);
            }
            JsonNode keys = rpc("state_getKeysPaged", params);
            if (keys.size() == 0) {
                break;
            }
            for (JsonNode keyNode : keys) {
                String key = keyNode.asText();
                scanned++;
                Optional<byte[]> value = storage(key);
                if (value.isEmpty()) {
                    continue;
                }
                LogisticsPallet.StoredDocument document = decode(() -> pallet.decodeDocument(value.get()), LogisticsPallet.DOCUMENTS);
                if (documentHash.equals(document.documentHash())) {
                    details.put("documentId", pallet.keyFromStorageKey(fromHex(key)));
                    details.put("timestamp", document.timestamp());
                    details.put("metadata", document.metadata());
                    details.put("registrar", document.registrar());
                    return VerificationResult.verified(details);
                }
            }
            if (keys.size() < settings.documentScanPageSize()) {
                break;
            }
            startKey = keys.get(keys.size() - 1).asText();
        }
        return VerificationResult.notFound("Document", details);
    }

    @Override
    public long currentHead() {
        return JsonRpcSupport.hexToLong("chain_getHeader", rpc("chain_getHeader", List.of()).path("number"));
    }

    /** Signed register_event extrinsics in blocks (fromExclusive, toInclusive]. */
    @Override
    public List<BridgeEvent> fetchEvents(long fromExclusive, long toInclusive) {
        List<BridgeEvent> events = new ArrayList<>();
        for (long number = fromExclusive + 1; number <= toInclusive; number++) {
            for (byte[] extrinsic : blockExtrinsics(number)) {
                Optional<LogisticsPallet.DecodedCall> call = decodePalletCall(extrinsic);
                if (call.isPresent() && call.get().kind() == EntityKind.EVENT) {
                    List<String> args = call.get().args();
                    events.add(new BridgeEvent(args.get(1), args.get(0), args.get(2), number,
                            ExtrinsicCodec.hash(extrinsic), clock.instant()));
                }
            }
        }
        log.debug("Found {} register_event extrinsics in blocks ({}, {}]", events.size(), fromExclusive, toInclusive);
        return events;
    }

    private String submit(byte[] call) {
        JsonNode nonceNode = rpc("system_accountNextIndex", List.of(accountAddress));
        if (!nonceNode.canConvertToLong()) {
            throw new LedgerRejectionException("system_accountNextIndex returned " + nonceNode);
        }
        byte[] extrinsic = ExtrinsicCodec.sign(call, keypair, nonceNode.asLong(), runtime(), settings.metadataHashExtension());
        String expectedHash = ExtrinsicCodec.hash(extrinsic);
        long headBefore = settings.waitForInclusion() ? currentHead() : 0L;

        String encoded = "0x" + HexFormat.of().formatHex(extrinsic);
        JsonNode result = rotator.callOnce("author_submitExtrinsic",
                endpoint -> invoke(endpoint, "author_submitExtrinsic", List.of(encoded)));
        String hash = result.isNull() ? null : result.asText(null);
        if (hash == null || hash.isBlank()) {
            throw new LedgerRejectionException("author_submitExtrinsic returned no extrinsic hash");
        }
        if (!hash.equalsIgnoreCase(expectedHash)) {
            log.warn("Node reported extrinsic hash {} but local encoding hashes to {}", hash, expectedHash);
        }
        if (settings.waitForInclusion()) {
            awaitInclusion(hash, headBefore);
        }
        return hash;
    }

    private void awaitInclusion(String hash, long scannedUpTo) {
        long deadline = clock.millis() + settings.inclusionTimeout().toMillis();
        long scanned = scannedUpTo;
        while (true) {
            long head = currentHead();
            for (long number = scanned + 1; number <= head; number++) {
                for (byte[] extrinsic : blockExtrinsics(number)) {
                    if (ExtrinsicCodec.hash(extrinsic).equalsIgnoreCase(hash)) {
                        log.debug("Extrinsic {} included in block {}", hash, number);
                        return;
                    }
                }
                scanned = number;
            }
            if (clock.millis() >= deadline) {
                throw new LedgerConnectivityException("Extrinsic " + hash + " not included within " + settings.inclusionTimeout());
            }
            sleep(settings.blockPollInterval());
        }
    }

    private SubstrateRuntime runtime() {
        String key = rotator.getEndpoints().get(0);
        try {
            return runtimeCache.get(key, this::fetchRuntime);
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new LedgerConnectivityException("Runtime version lookup failed", e);
        }
    }

    private SubstrateRuntime fetchRuntime() {
        JsonNode version = rpc("state_getRuntimeVersion", List.of());
        String genesis = rpc("chain_getBlockHash", List.of(0)).asText(null);
        if (genesis == null || !version.has("specVersion")) {
            throw new LedgerRejectionException("Node did not report runtime version or genesis hash");
        }
        SubstrateRuntime runtime = new SubstrateRuntime(version.path("specVersion").asLong(),
                version.path("transactionVersion").asLong(), fromHex(genesis));
        log.info("Substrate runtime: specVersion={}, transactionVersion={}, genesis={}",
                runtime.specVersion(), runtime.transactionVersion(), genesis);
        return runtime;
    }

    private List<byte[]> blockExtrinsics(long number) {
        return block(number).extrinsics();
    }

    private BlockBody block(long number) {
        JsonNode blockHash = rpc("chain_getBlockHash", List.of(number));
        if (blockHash.isNull() || blockHash.isMissingNode()) {
            return new BlockBody(null, List.of());
        }
        JsonNode block = rpc("chain_getBlock", List.of(blockHash.asText()));
        List<byte[]> extrinsics = new ArrayList<>();
        for (JsonNode extrinsic : block.path("block").path("extrinsics")) {
            extrinsics.add(fromHex(extrinsic.asText()));
        }
        return new BlockBody(blockHash.asText(), extrinsics);
    }

    private Optional<LogisticsPallet.DecodedCall> decodePalletCall(byte[] extrinsic) {
        try {
            return ExtrinsicCodec.signedCall(extrinsic, settings.metadataHashExtension()).flatMap(pallet::decodeCall);
        } catch (IllegalArgumentException e) {
            log.debug("Skipping undecodable pallet call: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<byte[]> storage(String key) {
        return readStorage(List.of(key));
    }

    private Optional<byte[]> storageAt(String key, String blockHash) {
        return readStorage(List.of(key, blockHash));
    }

    private Optional<byte[]> readStorage(List<String> params) {
        JsonNode value = rpc("state_getStorage", params);
        if (value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(fromHex(value.asText()));
    }

    private static <T> T decode(Supplier<T> decoder, String item) {
        try {
            return decoder.get();
        } catch (IllegalArgumentException e) {
            throw new LedgerRejectionException("Undecodable " + item + " storage value: " + e.getMessage(), e);
        }
    }

    private JsonNode rpc(String method, Object params) {
        return rotator.callWithRetry(method, endpoint -> invoke(endpoint, method, params));
    }

    private JsonNode invoke(String endpoint, String method, Object params) {
        String body = rpcClient.call(endpoint, method, params).block();
        return JsonRpcSupport.result(objectMapper, method, body);
    }

    private record BlockBody(String hash, List<byte[]> extrinsics) {
    }

    private static byte[] fromHex(String hex) {
        String digits = hex.startsWith("0x") ? hex.substring(2) : hex;
        return HexFormat.of().parseHex(digits);
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerConnectivityException("Interrupted while waiting for inclusion", e);
        }
    }
}
