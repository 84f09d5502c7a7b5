package com.txarchive.ingestion.endpoint;

import java.time.Instant;

/**
 * Read-only view of an endpoint's health for the status surface.
 */
public record EndpointSnapshot(
        String url,
        EndpointKind kind,
        HealthState health,
        int consecutiveFailures,
        int trips,
        Instant nextEligibleAt,
        int inFlight
) {
}
