package com.txarchive.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Lightweight event: a signature was observed on a streaming endpoint at the given slot.
 */
public record TransactionNotice(
        String signature,
        long slot,
        Instant observedAt,
        String sourceUrl
) {

    public TransactionNotice {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(observedAt, "observedAt");
        if (signature.isBlank()) {
            throw new IllegalArgumentException("signature must not be blank");
        }
    }
}
