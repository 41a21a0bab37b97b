package com.tracechain.ledger.substrate;

import reactor.core.publisher.Mono;

/**
 * Substrate node JSON-RPC over HTTP. Returns the raw response envelope; callers unwrap it.
 */
public interface SubstrateRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
