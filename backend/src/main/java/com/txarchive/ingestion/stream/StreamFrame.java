package com.txarchive.ingestion.stream;

import com.txarchive.domain.TransactionNotice;

/**
 * One decoded inbound PubSub frame.
 */
public record StreamFrame(Type type, TransactionNotice notice, Long subscriptionId, String detail) {

    public enum Type {
        /** Subscribe request acknowledged. */
        SUBSCRIBED,
        /** Subscribe request answered with a JSON-RPC error. */
        REJECTED,
        /** Transaction notification. */
        NOTICE,
        /** Well-formed notification filtered out (failed transaction). */
        SKIPPED,
        /** Not JSON, or a notification without a signature. */
        UNREADABLE,
        /** Well-formed frame of no interest. */
        IGNORED
    }

    static StreamFrame subscribed(long subscriptionId) {
        return new StreamFrame(Type.SUBSCRIBED, null, subscriptionId, null);
    }

    static StreamFrame rejected(String detail) {
        return new StreamFrame(Type.REJECTED, null, null, detail);
    }

    static StreamFrame notice(TransactionNotice notice) {
        return new StreamFrame(Type.NOTICE, notice, null, null);
    }

    static StreamFrame skipped(String detail) {
        return new StreamFrame(Type.SKIPPED, null, null, detail);
    }

    static StreamFrame unreadable(String detail) {
        return new StreamFrame(Type.UNREADABLE, null, null, detail);
    }

    static StreamFrame ignored() {
        return new StreamFrame(Type.IGNORED, null, null, null);
    }
}
