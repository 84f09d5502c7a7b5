package com.txarchive.ingestion.endpoint;

/**
 * Capability of a configured endpoint: JSON-RPC over HTTP or PubSub over WebSocket.
 */
public enum EndpointKind {
    REQUEST_RESPONSE,
    STREAMING
}
