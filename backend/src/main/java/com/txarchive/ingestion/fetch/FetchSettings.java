package com.txarchive.ingestion.fetch;

import java.time.Duration;

/**
 * Per-request knobs of the detail fetcher.
 *
 * @param parallelism        concurrent fetches per batch, further capped by the pool's connection limit
 * @param exhaustedIdleDelay pause before retrying a lease when the pool is busy or has nothing healthy
 */
public record FetchSettings(
        Duration requestTimeout,
        int parallelism,
        String encoding,
        String commitment,
        Duration exhaustedIdleDelay
) {

    public FetchSettings {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
    }
}
