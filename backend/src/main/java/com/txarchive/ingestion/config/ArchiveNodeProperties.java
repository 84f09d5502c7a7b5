package com.txarchive.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Node-level settings: batching, retention and lifecycle.
 */
@ConfigurationProperties(prefix = "txarchive.node")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ArchiveNodeProperties {

    /** Port of the external status API. Not bound by the ingestion engine. */
    private int listenPort = 8899;

    /** Not used by ingestion. */
    private String identityKeypairPath;

    @Min(1)
    private int maxTransactionBatchSize = 1000;

    /** Retention window in days; 0 keeps records forever. */
    @Min(0)
    private long storageRetentionDays = 30;

    /** A partial batch is flushed this long after its first notice. */
    @Min(1)
    private long flushTimeoutMs = 5_000L;

    /** How long shutdown waits for in-flight batches before cancelling them. */
    @Min(0)
    private long drainTimeoutMs = 30_000L;

    /** Start ingestion with the application context. */
    private boolean autoStart = true;
}
