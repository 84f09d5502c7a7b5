package com.txarchive.ingestion.endpoint;

/**
 * Circuit-breaker state of one endpoint.
 * HEALTHY: selectable. UNHEALTHY: excluded until its backoff elapses.
 * DEGRADED: backoff elapsed, handed to a single probe; success closes the breaker, failure re-opens it.
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
