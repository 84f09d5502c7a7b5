package com.txarchive.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-endpoint circuit breaker.
 */
@ConfigurationProperties(prefix = "txarchive.ingestion.circuit-breaker")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class CircuitBreakerProperties {

    /** Failures inside the window that open the breaker. */
    @Min(1)
    private int failureThreshold = 3;

    @Min(1)
    private long failureWindowMs = 60_000L;

    /** First backoff after the breaker opens; doubles on each consecutive trip. */
    private long baseBackoffMs = 1_000L;

    private long maxBackoffMs = 300_000L;

    private double jitterFactor = 0.2;
}
