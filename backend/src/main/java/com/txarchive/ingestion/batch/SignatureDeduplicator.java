package com.txarchive.ingestion.batch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;

/**
 * Bounded recently-seen set of signatures. An entry lives for the configured TTL after its first sighting;
 * when the set is full Caffeine evicts the least valuable entries first.
 */
public class SignatureDeduplicator {

    private final Cache<String, Boolean> seen;

    public SignatureDeduplicator(Duration ttl, long maxSize) {
        this(ttl, maxSize, Ticker.systemTicker());
    }

    SignatureDeduplicator(Duration ttl, long maxSize, Ticker ticker) {
        this.seen = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    /**
     * Atomically records the signature.
     *
     * @return true the first time a signature is seen within the TTL, false for duplicates
     */
    public boolean markFirstSeen(String signature) {
        return seen.asMap().putIfAbsent(signature, Boolean.TRUE) == null;
    }

    public long size() {
        seen.cleanUp();
        return seen.estimatedSize();
    }
}
