package com.txarchive.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * logsSubscribe streams: filter, liveness and deduplication.
 */
@ConfigurationProperties(prefix = "txarchive.ingestion.stream")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class StreamProperties {

    @NotBlank
    private String commitment = "confirmed";

    /** Subscribe with allWithVotes instead of all. */
    private boolean includeVotes = false;

    /** Drop notices of transactions that failed on chain. */
    private boolean skipFailed = true;

    @Min(1)
    private long connectTimeoutMs = 10_000L;

    /** Silence after which a subscribed stream is considered degraded; twice this tears it down. */
    @Min(1)
    private long idleTimeoutMs = 30_000L;

    /** Consecutive unreadable frames tolerated before reconnecting. */
    @Min(1)
    private int maxReadErrors = 5;

    /** Notices buffered between the streams and the batcher. */
    @Min(1)
    private int noticeBufferSize = 10_000;

    /** Lifetime of a signature in the recently-seen set; never shorter than the flush timeout. */
    @Min(1)
    private long dedupTtlMs = 300_000L;

    @Min(1)
    private long dedupMaxSize = 1_000_000L;
}
