package com.txarchive.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC client abstraction for testing and endpoint rotation.
 * Retries and failover are handled by the caller through the endpoint pool.
 */
public interface SolanaRpcClient {

    /**
     * Perform a single Solana JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "getTransaction"
     * @param params      method params (array or list)
     * @return response body as string (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
