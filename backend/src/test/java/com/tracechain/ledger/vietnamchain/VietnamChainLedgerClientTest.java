package com.tracechain.ledger.vietnamchain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracechain.common.RetryPolicy;
import com.tracechain.domain.EntityKind;
import com.tracechain.domain.UnifiedTransactionStatus;
import com.tracechain.ledger.BridgeEvent;
import com.tracechain.ledger.LedgerConnectivityException;
import com.tracechain.ledger.LedgerRejectionException;
import com.tracechain.ledger.RpcEndpointRotator;
import com.tracechain.ledger.TransactionStatusReport;
import com.tracechain.ledger.VerificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VietnamChainLedgerClientTest {

    private static final String BASE = "https://vnchain.test";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final Map<String, Supplier<ClientResponse>> responses = new HashMap<>();
    private final List<ClientRequest> requests = new ArrayList<>();
    private VietnamChainLedgerClient client;

    @BeforeEach
    void setUp() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            String key = request.method().name() + " " + request.url().getPath()
                    + (request.url().getQuery() == null ? "" : "?" + request.url().getQuery());
            Supplier<ClientResponse> response = responses.get(key);
            return Mono.just(response != null ? response.get() : ClientResponse.create(HttpStatus.NOT_FOUND).build());
        });
        VietnamChainRequestSigner signer = new VietnamChainRequestSigner("key-1", "s3cret", "org-7", objectMapper, clock);
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of(BASE), new RetryPolicy(1L, 1L, 0, 2));
        client = new VietnamChainLedgerClient(builder, rotator, signer, objectMapper, Duration.ofSeconds(5), clock);
    }

    private void respond(String methodAndPath, HttpStatus status, String json) {
        responses.put(methodAndPath, () -> ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
    }

    @Test
    void registerEvent_postsSignedRequestAndReturnsTransactionId() {
        respond("POST /api/v1/logistics/events", HttpStatus.OK, "{\"transactionId\":\"vn-tx-1\"}");

        String txId = client.registerEvent("SHP-1", "EVT-1", "BRIDGED_DELIVERED", "ab", "{}");

        assertThat(txId).isEqualTo("vn-tx-1");
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo(BASE + "/api/v1/logistics/events");
        assertThat(request.headers().getFirst(VietnamChainRequestSigner.HEADER_ORGANIZATION)).isEqualTo("org-7");
        assertThat(request.headers().getFirst(VietnamChainRequestSigner.HEADER_SIGNATURE)).isNotBlank();
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer key-1");
    }

    @Test
    void registerEvent_responseWithoutTransactionId_isRejection() {
        respond("POST /api/v1/logistics/events", HttpStatus.OK, "{\"ok\":true}");

        assertThatThrownBy(() -> client.registerEvent("SHP-1", "EVT-1", "PICKED_UP", "ab", "{}"))
                .isInstanceOf(LedgerRejectionException.class)
                .hasMessageContaining("No transaction ID");
    }

    @Test
    void registerEvent_serverError_isConnectivityAndNotRetried() {
        respond("POST /api/v1/logistics/events", HttpStatus.SERVICE_UNAVAILABLE, "{}");

        assertThatThrownBy(() -> client.registerEvent("SHP-1", "EVT-1", "PICKED_UP", "ab", "{}"))
                .isInstanceOf(LedgerConnectivityException.class);
        assertThat(requests).hasSize(1);
    }

    @Test
    void currentHead_acceptsNumericOrTextualBlockNumber() {
        respond("GET /api/v1/blocks/latest", HttpStatus.OK, "{\"blockNumber\":\"812\"}");

        assertThat(client.currentHead()).isEqualTo(812L);

        respond("GET /api/v1/blocks/latest", HttpStatus.OK, "{\"number\":813}");

        assertThat(client.currentHead()).isEqualTo(813L);
    }

    @Test
    void getTransactionStatus_mapsNativeStatusAndEntity() {
        respond("GET /api/v1/transactions/vn-tx-1", HttpStatus.OK,
                "{\"status\":\"confirmed\",\"blockNumber\":90,\"confirmations\":6,"
                        + "\"data\":{\"type\":\"event\",\"eventId\":\"EVT-1\"}}");

        TransactionStatusReport report = client.getTransactionStatus("vn-tx-1");

        assertThat(report.status()).isEqualTo(UnifiedTransactionStatus.CONFIRMED);
        assertThat(report.blockReference()).isEqualTo(90L);
        assertThat(report.confirmations()).isEqualTo(6L);
        assertThat(report.entityKind()).isEqualTo(EntityKind.EVENT);
        assertThat(report.entityId()).isEqualTo("EVT-1");
    }

    @Test
    void getTransactionStatus_unknownTransaction_isNotFound() {
        assertThat(client.getTransactionStatus("vn-missing").status()).isEqualTo(UnifiedTransactionStatus.NOT_FOUND);

        respond("GET /api/v1/transactions/vn-gone", HttpStatus.OK, "{\"error\":\"Transaction not found\"}");

        assertThat(client.getTransactionStatus("vn-gone").status()).isEqualTo(UnifiedTransactionStatus.NOT_FOUND);
    }

    @Test
    void mapStatus_nativeValues() {
        assertThat(VietnamChainLedgerClient.mapStatus("processing")).isEqualTo(UnifiedTransactionStatus.PENDING);
        assertThat(VietnamChainLedgerClient.mapStatus("CONFIRMED")).isEqualTo(UnifiedTransactionStatus.CONFIRMED);
        assertThat(VietnamChainLedgerClient.mapStatus("Rejected")).isEqualTo(UnifiedTransactionStatus.FAILED);
        assertThat(VietnamChainLedgerClient.mapStatus(null)).isEqualTo(UnifiedTransactionStatus.ERROR);
        assertThat(VietnamChainLedgerClient.mapStatus("weird")).isEqualTo(UnifiedTransactionStatus.ERROR);
    }

    @Test
    void verifyEvent_storedEvent_checksShipment() {
        respond("GET /api/v1/logistics/events/EVT-1", HttpStatus.OK,
                "{\"shipmentId\":\"SHP-1\",\"eventType\":\"DELIVERED\",\"dataHash\":\"ab\",\"transactionId\":\"vn-tx-1\"}");

        VerificationResult ok = client.verifyEvent("SHP-1", "EVT-1");
        VerificationResult mismatch = client.verifyEvent("SHP-9", "EVT-1");
        VerificationResult missing = client.verifyEvent("SHP-1", "EVT-2");

        assertThat(ok.verified()).isTrue();
        assertThat(ok.details()).containsEntry("txHandle", "vn-tx-1");
        assertThat(mismatch.verified()).isFalse();
        assertThat(missing.reason()).isEqualTo("Event not found on blockchain");
    }

    @Test
    void fetchEvents_queriesBlockRangeAndSkipsIncompleteEntries() {
        respond("GET /api/v1/logistics/events?fromBlock=11&toBlock=20", HttpStatus.OK,
                "{\"events\":["
                        + "{\"eventId\":\"EVT-1\",\"shipmentId\":\"SHP-1\",\"eventType\":\"PICKED_UP\",\"blockNumber\":12,\"transactionId\":\"vn-1\"},"
                        + "{\"shipmentId\":\"SHP-1\",\"blockNumber\":13}"
                        + "]}");

        List<BridgeEvent> events = client.fetchEvents(10, 20);

        assertThat(events).containsExactly(
                new BridgeEvent("EVT-1", "SHP-1", "PICKED_UP", 12L, "vn-1", clock.instant()));
    }

    @Test
    void errorBody_otherThanNotFound_isRejection() {
        respond("GET /api/v1/logistics/shipments/SHP-1", HttpStatus.OK, "{\"error\":\"permission denied\"}");

        assertThatThrownBy(() -> client.verifyShipment("SHP-1", null))
                .isInstanceOf(LedgerRejectionException.class)
                .hasMessageContaining("permission denied");
    }
}
