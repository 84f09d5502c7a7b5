package com.txarchive.ingestion.adapter;

/**
 * Thrown when an RPC or stream call fails (HTTP, WebSocket, JSON-RPC error or timeout). Recoverable.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
