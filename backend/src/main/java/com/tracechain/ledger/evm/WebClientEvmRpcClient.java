package com.tracechain.ledger.evm;

import com.tracechain.ledger.JsonRpcSupport;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EVM JSON-RPC client using WebClient. Used by EthereumLedgerClient.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final Duration requestTimeout;
    private final AtomicLong requestId = new AtomicLong();

    public WebClientEvmRpcClient(WebClient.Builder builder, Duration requestTimeout) {
        this.webClient = builder.build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestId.incrementAndGet(),
                "method", method,
                "params", params != null ? params : new Object[]{}
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
