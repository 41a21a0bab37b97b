package com.tracechain.ledger.vietnamchain;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger client for the VietnamChain permissioned REST API. Every request carries HMAC authentication headers
 * from {@link VietnamChainRequestSigner}. Reads are retried on connectivity failures; writes are sent once.
 * HTTP 404 and "not found" error bodies mean absence.
 */
@Slf4j
public class VietnamChainLedgerClient implements LedgerClient {

    static final String SHIPMENTS = "api/v1/logistics/shipments";
    static final String EVENTS = "api/v1/logistics/events";
    static final String DOCUMENTS = "api/v1/documents";
    static final String TRANSACTIONS = "api/v1/transactions";
    static final String LATEST_BLOCK = "api/v1/blocks/latest";

    private final WebClient webClient;
    private final RpcEndpointRotator rotator;
    private final VietnamChainRequestSigner signer;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Clock clock;

    public VietnamChainLedgerClient(WebClient.Builder builder,
                                    RpcEndpointRotator rotator,
                                    VietnamChainRequestSigner signer,
                                    ObjectMapper objectMapper,
                                    Duration requestTimeout,
                                    Clock clock) {
        this.webClient = builder.build();
        this.rotator = rotator;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        log.info("VietnamChain ledger client ready: endpoints={}", rotator.getEndpoints());
    }

    @Override
    public LedgerId ledgerId() {
        return LedgerId.VIETNAMCHAIN;
    }

    @Override
    public String registerShipment(String shipmentId, String trackingNumber, String dataHash, String metadataJson) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("shipmentId", shipmentId);
        body.put("trackingNumber", trackingNumber);
        body.put("dataHash", dataHash);
        body.put("metadata", metadataJson);
        body.put("timestamp", timestamp());
        String txId = submit(SHIPMENTS, body);
        log.info("Shipment {} registered on VietnamChain: {}", shipmentId, txId);
        return txId;
    }

    @Override
    public String registerEvent(String shipmentId, String eventId, String eventType, String dataHash, String metadataJson) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("shipmentId", shipmentId);
        body.put("eventId", eventId);
        body.put("eventType", eventType);
        body.put("dataHash", dataHash);
        body.put("metadata", metadataJson);
        body.put("timestamp", timestamp());
        String txId = submit(EVENTS, body);
        log.info("Event {} ({}) registered on VietnamChain: {}", eventId, eventType, txId);
        return txId;
    }

    @Override
    public String registerDocument(String documentHash, String metadataJson) {
        String documentId = UUID.randomUUID().toString();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("documentId", documentId);
        body.put("documentHash", documentHash);
        body.put("metadata", metadataJson);
        body.put("timestamp", timestamp());
        String txId = submit(DOCUMENTS, body);
        log.info("Document {} registered on VietnamChain: {}", documentId, txId);
        return txId;
    }

    @Override
    public TransactionStatusReport getTransactionStatus(String txHandle) {
        try {
            Optional<JsonNode> response = get(TRANSACTIONS + "/" + txHandle);
            if (response.isEmpty()) {
                return TransactionStatusReport.notFound(ledgerId(), txHandle);
            }
            JsonNode tx = response.get();
            String nativeStatus = tx.path("status").asText("");
            UnifiedTransactionStatus status = mapStatus(nativeStatus);
            JsonNode data = tx.path("data");
            EntityKind kind = EntityKind.fromKeyOrNull(data.path("type").asText(null));
            String entityId = kind == null ? null : switch (kind) {
                case SHIPMENT -> data.path("shipmentId").asText(null);
                case EVENT -> data.path("eventId").asText(null);
                case DOCUMENT -> data.path("documentHash").asText(null);
            };
            return new TransactionStatusReport(ledgerId(), txHandle, status,
                    optionalLong(tx, "blockNumber"), optionalLong(tx, "confirmations"), kind, entityId,
                    status == UnifiedTransactionStatus.ERROR ? "Unknown transaction status: " + nativeStatus
                            : tx.path("errorMessage").asText(null));
        } catch (BlockchainException e) {
            log.warn("Status lookup for {} failed: {}", txHandle, e.getMessage());
            return TransactionStatusReport.error(ledgerId(), txHandle, e.getMessage());
        }
    }

    static UnifiedTransactionStatus mapStatus(String nativeStatus) {
        return switch (nativeStatus == null ? "" : nativeStatus.toUpperCase(Locale.ROOT)) {
            case "PENDING", "PROCESSING" -> UnifiedTransactionStatus.PENDING;
            case "CONFIRMED" -> UnifiedTransactionStatus.CONFIRMED;
            case "FAILED", "REJECTED" -> UnifiedTransactionStatus.FAILED;
            default -> UnifiedTransactionStatus.ERROR;
        };
    }

    @Override
    public VerificationResult verifyShipment(String shipmentId, String trackingNumber) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("shipmentId", shipmentId);
        Optional<JsonNode> response = get(SHIPMENTS + "/" + shipmentId);
        if (response.isEmpty()) {
            return VerificationResult.notFound("Shipment", details);
        }
        JsonNode shipment = response.get();
        String storedTracking = shipment.path("trackingNumber").asText(null);
        details.put("trackingNumber", storedTracking);
        details.put("dataHash", shipment.path("dataHash").asText(null));
        details.put("timestamp", shipment.path("timestamp").asText(null));
        details.put("metadata", shipment.path("metadata").asText(null));
        details.put("txHandle", shipment.path("transactionId").asText(null));
        if (trackingNumber != null && !trackingNumber.isBlank() && !trackingNumber.equals(storedTracking)) {
            return VerificationResult.rejected("Tracking number mismatch (stored: " + storedTracking + ")", details);
        }
        return VerificationResult.verified(details);
    }

    @Override
    public VerificationResult verifyEvent(String shipmentId, String eventId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventId", eventId);
        Optional<JsonNode> response = get(EVENTS + "/" + eventId);
        if (response.isEmpty()) {
            return VerificationResult.notFound("Event", details);
        }
        JsonNode event = response.get();
        String storedShipmentId = event.path("shipmentId").asText(null);
        details.put("shipmentId", storedShipmentId);
        details.put("eventType", event.path("eventType").asText(null));
        details.put("dataHash", event.path("dataHash").asText(null));
        details.put("timestamp", event.path("timestamp").asText(null));
        details.put("metadata", event.path("metadata").asText(null));
        details.put("txHandle", event.path("transactionId").asText(null));
        if (shipmentId != null && !shipmentId.isBlank() && !shipmentId.equals(storedShipmentId)) {
            return VerificationResult.rejected("Shipment ID mismatch (stored: " + storedShipmentId + ")", details);
        }
        return VerificationResult.verified(details);
    }

    @Override
    public VerificationResult verifyDocument(String documentHash) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("documentHash", documentHash);
        Optional<JsonNode> response = get(DOCUMENTS + "/hash/" + documentHash);
        if (response.isEmpty()) {
            return VerificationResult.notFound("Document", details);
        }
        JsonNode document = response.get();
        details.put("documentId", document.path("documentId").asText(null));
        details.put("timestamp", document.path("timestamp").asText(null));
        details.put("metadata", document.path("metadata").asText(null));
        details.put("txHandle", document.path("transactionId").asText(null));
        return VerificationResult.verified(details);
    }

    @Override
    public long currentHead() {
        JsonNode block = get(LATEST_BLOCK)
                .orElseThrow(() -> new LedgerRejectionException("VietnamChain reported no latest block"));
        Long number = optionalLong(block, "blockNumber");
        if (number == null) {
            number = optionalLong(block, "number");
        }
        if (number == null) {
            throw new LedgerRejectionException("VietnamChain latest block has no number: " + block);
        }
        return number;
    }

    @Override
    public List<BridgeEvent> fetchEvents(long fromExclusive, long toInclusive) {
        List<BridgeEvent> events = new ArrayList<>();
        if (toInclusive <= fromExclusive) {
            return events;
        }
        Optional<JsonNode> response = get(EVENTS + "?fromBlock=" + (fromExclusive + 1) + "&toBlock=" + toInclusive);
        if (response.isEmpty()) {
            return events;
        }
        JsonNode list = response.get().isArray() ? response.get() : response.get().path("events");
        for (JsonNode event : list) {
            String eventId = event.path("eventId").asText(null);
            Long block = optionalLong(event, "blockNumber");
            if (eventId == null || block == null) {
                log.warn("Skipping VietnamChain event without id or block: {}", event);
                continue;
            }
            events.add(new BridgeEvent(eventId, event.path("shipmentId").asText(null), event.path("eventType").asText(null),
                    block, event.path("transactionId").asText(null), clock.instant()));
        }
        return events;
    }

    private String submit(String endpoint, Map<String, Object> body) {
        JsonNode response = rotator.callOnce("POST " + endpoint,
                        baseUrl -> exchange(baseUrl, HttpMethod.POST, endpoint, body))
                .orElseThrow(() -> new LedgerRejectionException("VietnamChain " + endpoint + " returned no body"));
        String txId = response.path("transactionId").asText(null);
        if (txId == null || txId.isBlank()) {
            throw new LedgerRejectionException("No transaction ID returned from VietnamChain for " + endpoint);
        }
        return txId;
    }

    private Optional<JsonNode> get(String endpoint) {
        return rotator.callWithRetry("GET " + endpoint, baseUrl -> exchange(baseUrl, HttpMethod.GET, endpoint, null));
    }

    /**
     * One signed request. Empty on HTTP 404 or an error body saying "not found"; other error bodies are rejections.
     */
    private Optional<JsonNode> exchange(String baseUrl, HttpMethod method, String endpoint, Map<String, Object> body) {
        String json = body == null ? null : signer.canonicalJson(body);
        Map<String, String> headers = signer.sign(method.name(), endpoint, json);
        WebClient.RequestBodySpec request = webClient.method(method)
                .uri(join(baseUrl, endpoint))
                .headers(h -> {
                    headers.forEach(h::set);
                    h.setBearerAuth(signer.getApiKey());
                })
                .contentType(MediaType.APPLICATION_JSON);
        WebClient.RequestHeadersSpec<?> ready = json == null ? request : request.bodyValue(json);
        Optional<String> raw = ready.retrieve()
                .bodyToMono(String.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .timeout(requestTimeout)
                .onErrorMap(e -> JsonRpcSupport.mapTransportError(method.name() + " " + endpoint, e))
                .blockOptional();
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw.get());
        } catch (JsonProcessingException e) {
            throw new LedgerConnectivityException("VietnamChain " + endpoint + " returned invalid JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.isTextual() ? error.asText() : error.toString();
            if (message.toLowerCase(Locale.ROOT).contains("not found")) {
                return Optional.empty();
            }
            throw new LedgerRejectionException("VietnamChain " + endpoint + " error: " + message);
        }
        return Optional.of(root);
    }

    private String timestamp() {
        return clock.instant().atOffset(ZoneOffset.UTC).toLocalDateTime().toString();
    }

    private static Long optionalLong(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isNumber()) {
            return value.asLong();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String join(String baseUrl, String endpoint) {
        return baseUrl.endsWith("/") ? baseUrl + endpoint : baseUrl + "/" + endpoint;
    }
}
