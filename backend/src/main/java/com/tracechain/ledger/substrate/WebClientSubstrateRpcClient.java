package com.tracechain.ledger.substrate;

import com.tracechain.ledger.JsonRpcSupport;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Substrate JSON-RPC client using WebClient. Used by SubstrateLedgerClient.
 */
public class WebClientSubstrateRpcClient implements SubstrateRpcClient {

    private final WebClient webClient;
    private final Duration requestTimeout;
    private final AtomicLong requestId = new AtomicLong();

    public WebClientSubstrateRpcClient(WebClient.Builder builder, Duration requestTimeout) {
        this.webClient = builder.build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestId.incrementAndGet(),
                "method", method,
                "params", params != null ? params : List.of()
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .onErrorMap(e -> JsonRpcSupport.mapTransportError(method, e));
    }
}
