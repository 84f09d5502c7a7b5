package com.txarchive.ingestion.endpoint;

import lombok.Getter;

/**
 * No connection could be leased. Recoverable: the caller idles and retries.
 */
@Getter
public class EndpointExhaustedException extends RuntimeException {

    public enum Reason {
        /** Global connection cap reached. */
        BUSY,
        /** No endpoint of the requested kind is currently selectable. */
        NO_HEALTHY_ENDPOINT
    }

    private final Reason reason;
    private final EndpointKind kind;

    public EndpointExhaustedException(Reason reason, EndpointKind kind, String message) {
        super(message);
        this.reason = reason;
        this.kind = kind;
    }
}
