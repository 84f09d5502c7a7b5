package com.txarchive.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * getTransaction detail fetches.
 */
@ConfigurationProperties(prefix = "txarchive.ingestion.fetch")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class FetchProperties {

    @Min(1)
    private long requestTimeoutMs = 15_000L;

    /** Concurrent fetches per batch; also bounded by max-connections. */
    @Min(1)
    private int parallelism = 16;

    /** json or jsonParsed. */
    @NotBlank
    private String encoding = "json";

    @Min(1)
    private int maxRequestsPerSecond = 40;

    /** Longest wait for a local rate-limit permit before treating the pool as busy. */
    @Min(0)
    private long rateLimiterTimeoutMs = 5_000L;

    /** Idle delay before retrying when no endpoint could be leased. */
    @Min(1)
    private long exhaustedIdleDelayMs = 1_000L;
}
