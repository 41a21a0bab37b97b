package com.tracechain.ledger.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracechain.domain.EntityKind;
import com.tracechain.domain.LedgerId;
import com.tracechain.domain.UnifiedTransactionStatus;
import com.tracechain.ledger.BridgeEvent;
import com.tracechain.ledger.JsonRpcSupport;
import com.tracechain.ledger.LedgerClient;
import com.tracechain.ledger.LedgerConfigurationException;
import com.tracechain.ledger.LedgerConnectivityException;
import com.tracechain.ledger.BlockchainException;
import com.tracechain.ledger.LedgerRejectionException;
import com.tracechain.ledger.RpcEndpointRotator;
import com.tracechain.ledger.TransactionStatusReport;
import com.tracechain.ledger.VerificationResult;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ledger client for Ethereum-family chains. Writes are legacy EIP-155 transactions to the ShipmentRegistry and
 * EventLog contracts, signed locally; reads are {@code eth_call}s. All JSON-RPC goes through the endpoint rotator
 * and the shared EVM rate limiter.
 */
@Slf4j
public class EthereumLedgerClient implements LedgerClient {

    private static final Map<Long, String> NETWORK_NAMES = Map.of(
            1L, "ethereum",
            5L, "goerli",
            11155111L, "sepolia",
            137L, "polygon",
            80001L, "polygon_mumbai");

    static final BigInteger GAS_LIMIT = BigInteger.valueOf(500_000);
    /** Max block span per eth_getLogs request. */
    static final int LOG_CHUNK_BLOCKS = 2_000;

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Credentials credentials;
    private final long chainId;
    private final ShipmentRegistryContract shipmentRegistry;
    private final EventLogContract eventLog;
    private final Clock clock;

    /**
     * @param shipmentRegistryAddress may be blank; shipment calls then fail with {@link LedgerConfigurationException}
     * @param eventLogAddress         may be blank; event and document calls then fail the same way
     * @throws LedgerConfigurationException when the private key is missing or malformed
     */
    public EthereumLedgerClient(EvmRpcClient rpcClient,
                                RpcEndpointRotator rotator,
                                RateLimiter rateLimiter,
                                ObjectMapper objectMapper,
                                String privateKey,
                                long chainId,
                                String shipmentRegistryAddress,
                                String eventLogAddress,
                                Clock clock) {
        if (privateKey == null || privateKey.isBlank()) {
            throw new LedgerConfigurationException("Ethereum private key not configured");
        }
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        try {
            this.credentials = Credentials.create(privateKey.trim());
        } catch (RuntimeException e) {
            throw new LedgerConfigurationException("Ethereum private key is malformed", e);
        }
        this.chainId = chainId;
        this.shipmentRegistry = isBlank(shipmentRegistryAddress) ? null : new ShipmentRegistryContract(shipmentRegistryAddress);
        this.eventLog = isBlank(eventLogAddress) ? null : new EventLogContract(eventLogAddress);
        this.clock = clock;
        log.info("Ethereum ledger client ready: network={}, account={}", networkName(), credentials.getAddress());
    }

    @Override
    public LedgerId ledgerId() {
        return LedgerId.ETHEREUM;
    }

    public String getAccountAddress() {
        return credentials.getAddress();
    }

    /** Human-readable network name for the configured chain id. */
    public String networkName() {
        return networkName(chainId);
    }

    static String networkName(long chainId) {
        String known = NETWORK_NAMES.get(chainId);
        return known != null ? known : "chain_" + chainId;
    }

    @Override
    public String registerShipment(String shipmentId, String trackingNumber, String dataHash, String metadataJson) {
        ShipmentRegistryContract contract = requireShipmentRegistry();
        String txHash = sendTransaction(contract.getAddress(),
                contract.encodeRegisterShipment(shipmentId, trackingNumber, dataHash, metadataJson));
        log.info("Shipment {} submitted to {}: {}", shipmentId, networkName(), txHash);
        return txHash;
    }

    @Override
    public String registerEvent(String shipmentId, String eventId, String eventType, String dataHash, String metadataJson) {
        EventLogContract contract = requireEventLog();
        String txHash = sendTransaction(contract.getAddress(),
                contract.encodeLogEvent(shipmentId, eventId, eventType, dataHash, metadataJson));
        log.info("Event {} ({}) submitted to {}: {}", eventId, eventType, networkName(), txHash);
        return txHash;
    }

    @Override
    public String registerDocument(String documentHash, String metadataJson) {
        EventLogContract contract = requireEventLog();
        String documentId = "doc_" + clock.instant().getEpochSecond() + "_"
                + documentHash.substring(0, Math.min(8, documentHash.length()));
        String txHash = sendTransaction(contract.getAddress(),
                contract.encodeLogDocument(documentId, documentHash, metadataJson));
        log.info("Document {} submitted to {}: {}", documentId, networkName(), txHash);
        return txHash;
    }

    @Override
    public TransactionStatusReport getTransactionStatus(String txHandle) {
        try {
            JsonNode receipt = rpc("eth_getTransactionReceipt", List.of(txHandle));
            if (receipt.isNull() || receipt.isMissingNode()) {
                JsonNode tx = rpc("eth_getTransactionByHash", List.of(txHandle));
                return tx.isNull() || tx.isMissingNode()
                        ? TransactionStatusReport.notFound(ledgerId(), txHandle)
                        : TransactionStatusReport.pending(ledgerId(), txHandle);
            }
            long block = JsonRpcSupport.hexToLong("eth_getTransactionReceipt", receipt.path("blockNumber"));
            long confirmations = Math.max(0, currentHead() - block);
            String nativeStatus = receipt.path("status").asText("");
            UnifiedTransactionStatus status = mapReceiptStatus(nativeStatus);
            EntityKind kind = entityKindFromLogs(receipt.path("logs"));
            String entityId = kind == null ? null : entityIdFromInput(kind, txHandle);
            String error = switch (status) {
                case FAILED -> "Transaction reverted";
                case ERROR -> "Unknown receipt status: " + nativeStatus;
                default -> null;
            };
            return new TransactionStatusReport(ledgerId(), txHandle, status, block, confirmations, kind, entityId, error);
        } catch (BlockchainException e) {
            log.warn("Status lookup for {} failed: {}", txHandle, e.getMessage());
            return TransactionStatusReport.error(ledgerId(), txHandle, e.getMessage());
        }
    }

    static UnifiedTransactionStatus mapReceiptStatus(String nativeStatus) {
        return switch (nativeStatus) {
            case "0x1" -> UnifiedTransactionStatus.CONFIRMED;
            case "0x0" -> UnifiedTransactionStatus.FAILED;
            default -> UnifiedTransactionStatus.ERROR;
        };
    }

    @Override
    public VerificationResult verifyShipment(String shipmentId, String trackingNumber) {
        ShipmentRegistryContract contract = requireShipmentRegistry();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("shipmentId", shipmentId);
        details.put("contract", contract.getAddress());
        Optional<ShipmentRegistryContract.StoredShipment> stored = ethCall(contract.getAddress(), contract.encodeGetShipment(shipmentId))
                .flatMap(output -> contract.decodeGetShipment(shipmentId, output));
        if (stored.isEmpty()) {
            return VerificationResult.notFound("Shipment", details);
        }
        ShipmentRegistryContract.StoredShipment shipment = stored.get();
        details.put("trackingNumber", shipment.trackingNumber());
        details.put("dataHash", shipment.dataHash());
        details.put("timestamp", shipment.timestamp());
        if (!isBlank(trackingNumber) && !trackingNumber.equals(shipment.trackingNumber())) {
            return VerificationResult.rejected("Tracking number mismatch", details);
        }
        return VerificationResult.verified(details);
    }

    @Override
    public VerificationResult verifyEvent(String shipmentId, String eventId) {
        EventLogContract contract = requireEventLog();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventId", eventId);
        details.put("contract", contract.getAddress());
        Optional<EventLogContract.StoredEvent> stored = ethCall(contract.getAddress(), contract.encodeGetEvent(eventId))
                .flatMap(output -> contract.decodeGetEvent(eventId, output));
        if (stored.isEmpty()) {
            return VerificationResult.notFound("Event", details);
        }
        EventLogContract.StoredEvent event = stored.get();
        details.put("shipmentId", event.shipmentId());
        details.put("eventType", event.eventType());
        details.put("dataHash", event.dataHash());
        details.put("timestamp", event.timestamp());
        if (!isBlank(shipmentId) && !shipmentId.equals(event.shipmentId())) {
            return VerificationResult.rejected("Event does not belong to shipment " + shipmentId, details);
        }
        return VerificationResult.verified(details);
    }

    @Override
    public VerificationResult verifyDocument(String documentHash) {
        EventLogContract contract = requireEventLog();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("documentHash", documentHash);
        details.put("contract", contract.getAddress());
        Optional<EventLogContract.StoredDocument> stored = ethCall(contract.getAddress(), contract.encodeGetDocument(documentHash))
                .flatMap(output -> contract.decodeGetDocument(documentHash, output));
        if (stored.isEmpty()) {
            return VerificationResult.notFound("Document", details);
        }
        details.put("timestamp", stored.get().timestamp());
        details.put("metadata", stored.get().metadata());
        return VerificationResult.verified(details);
    }

    @Override
    public long currentHead() {
        return JsonRpcSupport.hexToLong("eth_blockNumber", rpc("eth_blockNumber", List.of()));
    }

    /**
     * EventLogged logs in (fromExclusive, toInclusive], queried in {@value #LOG_CHUNK_BLOCKS}-block chunks. Ids are
     * recovered from each log's transaction input since the indexed strings are only present as hashes.
     */
    @Override
    public List<BridgeEvent> fetchEvents(long fromExclusive, long toInclusive) {
        EventLogContract contract = requireEventLog();
        List<BridgeEvent> events = new ArrayList<>();
        if (toInclusive <= fromExclusive) {
            return events;
        }
        String topic = EventLogContract.eventLoggedTopic();
        for (long start = fromExclusive + 1; start <= toInclusive; start += LOG_CHUNK_BLOCKS) {
            long end = Math.min(toInclusive, start + LOG_CHUNK_BLOCKS - 1);
            Map<String, Object> filter = Map.of(
                    "address", contract.getAddress(),
                    "topics", List.of(topic),
                    "fromBlock", toHexQuantity(start),
                    "toBlock", toHexQuantity(end));
            JsonNode logs = rpc("eth_getLogs", List.of(filter));
            for (JsonNode logNode : logs) {
                toBridgeEvent(contract, logNode).ifPresent(events::add);
            }
        }
        log.debug("Found {} EventLogged entries in blocks ({}, {}]", events.size(), fromExclusive, toInclusive);
        return events;
    }

    private Optional<BridgeEvent> toBridgeEvent(EventLogContract contract, JsonNode logNode) {
        String txHash = logNode.path("transactionHash").asText(null);
        if (txHash == null || logNode.path("removed").asBoolean(false)) {
            return Optional.empty();
        }
        long block = JsonRpcSupport.hexToLong("eth_getLogs", logNode.path("blockNumber"));
        JsonNode tx = rpc("eth_getTransactionByHash", List.of(txHash));
        Optional<EventLogContract.LoggedEventCall> call = contract.decodeLogEventInput(tx.path("input").asText(null));
        if (call.isEmpty()) {
            log.warn("EventLogged in {} was not emitted by a direct logEvent call; skipped", txHash);
            return Optional.empty();
        }
        JsonNode topics = logNode.path("topics");
        String eventIdTopic = topics.size() > 2 ? topics.get(2).asText("") : "";
        if (!eventIdTopic.equalsIgnoreCase(Hash.sha3String(call.get().eventId()))) {
            log.warn("EventLogged topic in {} does not match decoded event id {}; skipped", txHash, call.get().eventId());
            return Optional.empty();
        }
        return Optional.of(new BridgeEvent(call.get().eventId(), call.get().shipmentId(), call.get().eventType(),
                block, txHash, clock.instant()));
    }

    private EntityKind entityKindFromLogs(JsonNode logs) {
        String shipmentTopic = ShipmentRegistryContract.shipmentRegisteredTopic();
        String eventTopic = EventLogContract.eventLoggedTopic();
        String documentTopic = EventLogContract.documentLoggedTopic();
        for (JsonNode logNode : logs) {
            String topic0 = logNode.path("topics").path(0).asText("");
            if (topic0.equalsIgnoreCase(shipmentTopic)) {
                return EntityKind.SHIPMENT;
            }
            if (topic0.equalsIgnoreCase(eventTopic)) {
                return EntityKind.EVENT;
            }
            if (topic0.equalsIgnoreCase(documentTopic)) {
                return EntityKind.DOCUMENT;
            }
        }
        return null;
    }

    private String entityIdFromInput(EntityKind kind, String txHandle) {
        JsonNode tx = rpc("eth_getTransactionByHash", List.of(txHandle));
        String input = tx.path("input").asText(null);
        return switch (kind) {
            case SHIPMENT -> shipmentRegistry == null ? null : shipmentRegistry.decodeRegisteredShipmentId(input).orElse(null);
            case EVENT -> eventLog == null ? null
                    : eventLog.decodeLogEventInput(input).map(EventLogContract.LoggedEventCall::eventId).orElse(null);
            case DOCUMENT -> eventLog == null ? null : eventLog.decodeLoggedDocumentHash(input).orElse(null);
        };
    }

    private String sendTransaction(String to, String data) {
        BigInteger nonce = Numeric.decodeQuantity(rpc("eth_getTransactionCount",
                List.of(credentials.getAddress(), "pending")).asText());
        BigInteger gasPrice = Numeric.decodeQuantity(rpc("eth_gasPrice", List.of()).asText())
                .multiply(BigInteger.valueOf(11))
                .divide(BigInteger.TEN);
        RawTransaction tx = RawTransaction.createTransaction(nonce, gasPrice, GAS_LIMIT, to, BigInteger.ZERO, data);
        String signed = Numeric.toHexString(TransactionEncoder.signMessage(tx, chainId, credentials));
        JsonNode result = rotator.callOnce("eth_sendRawTransaction",
                endpoint -> invoke(endpoint, "eth_sendRawTransaction", List.of(signed)));
        String txHash = result.asText(null);
        if (txHash == null || txHash.isBlank() || result.isNull()) {
            throw new LedgerRejectionException("eth_sendRawTransaction returned no transaction hash");
        }
        return txHash;
    }

    /** {@code eth_call} at latest; empty on revert or empty output (unknown id). */
    private Optional<String> ethCall(String to, String data) {
        try {
            JsonNode result = rpc("eth_call", List.of(Map.of("to", to, "data", data), "latest"));
            String output = result.asText("");
            return output.isEmpty() || "0x".equals(output) ? Optional.empty() : Optional.of(output);
        } catch (LedgerRejectionException e) {
            if (e.getMessage() != null && e.getMessage().toLowerCase().contains("revert")) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private JsonNode rpc(String method, Object params) {
        return rotator.callWithRetry(method, endpoint -> invoke(endpoint, method, params));
    }

    private JsonNode invoke(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new LedgerConnectivityException("EVM RPC local rate limit exceeded for " + method);
        }
        String body = rpcClient.call(endpoint, method, params).block();
        return JsonRpcSupport.result(objectMapper, method, body);
    }

    private ShipmentRegistryContract requireShipmentRegistry() {
        if (shipmentRegistry == null) {
            throw new LedgerConfigurationException("ShipmentRegistry contract address not configured");
        }
        return shipmentRegistry;
    }

    private EventLogContract requireEventLog() {
        if (eventLog == null) {
            throw new LedgerConfigurationException("EventLog contract address not configured");
        }
        return eventLog;
    }

    private static String toHexQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
