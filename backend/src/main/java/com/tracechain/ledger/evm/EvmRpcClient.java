package com.tracechain.ledger.evm;

import reactor.core.publisher.Mono;

/**
 * Ethereum JSON-RPC transport. Endpoint choice and retries are handled by the caller through RpcEndpointRotator.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl node endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      positional params
     * @return raw response body (JSON envelope); errors are LedgerConnectivityException or LedgerRejectionException
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
