package com.txarchive.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy for RPC fetches and stream reconnects (exponential backoff ± jitter, capped).
 */
@ConfigurationProperties(prefix = "txarchive.ingestion.retry")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Cap on any single delay. Default 30s. */
    private long maxDelayMs = 30_000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Attempts per signature across endpoints before the fetch is marked failed. Default 3. */
    @Min(1)
    private int maxAttempts = 3;
}
