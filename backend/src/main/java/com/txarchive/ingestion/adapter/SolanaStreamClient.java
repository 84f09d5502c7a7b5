package com.txarchive.ingestion.adapter;

import reactor.core.publisher.Flux;

/**
 * Solana PubSub (WebSocket) transport. Opens a connection, sends one subscribe request and exposes
 * every inbound text frame. Cancelling the returned Flux closes the connection.
 */
public interface SolanaStreamClient {

    /**
     * @param endpointUrl      ws:// or wss:// URL
     * @param subscribeRequest JSON-RPC subscribe request sent once the socket is open
     * @return inbound frames in receipt order; errors with {@link RpcException} or
     * {@link SubscriptionRejectedException} when the connection fails or is refused
     */
    Flux<String> stream(String endpointUrl, String subscribeRequest);
}
