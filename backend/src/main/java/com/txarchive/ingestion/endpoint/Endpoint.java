package com.txarchive.ingestion.endpoint;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * A configured data source. Health fields are mutated only by {@link EndpointPool} under its lock.
 */
public class Endpoint {

    @Getter
    private final String url;
    @Getter
    private final EndpointKind kind;
    @Getter
    private final int weight;

    @Getter
    private volatile HealthState health = HealthState.HEALTHY;
    @Getter
    private volatile int consecutiveFailures;
    @Getter
    private volatile Instant nextEligibleAt = Instant.EPOCH;
    @Getter
    private volatile Instant lastUsedAt = Instant.EPOCH;

    /** Failure timestamps inside the breaker's sliding window. */
    final Deque<Instant> recentFailures = new ArrayDeque<>();
    int trips;
    long currentWeight;
    boolean probeInFlight;
    int inFlight;

    public Endpoint(String url, EndpointKind kind) {
        this(url, kind, 1);
    }

    public Endpoint(String url, EndpointKind kind, int weight) {
        this.url = Objects.requireNonNull(url, "url");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (weight < 1) {
            throw new IllegalArgumentException("weight must be >= 1");
        }
        this.weight = weight;
    }

    void setHealth(HealthState health) {
        this.health = health;
    }

    void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    void setNextEligibleAt(Instant nextEligibleAt) {
        this.nextEligibleAt = nextEligibleAt;
    }

    void setLastUsedAt(Instant lastUsedAt) {
        this.lastUsedAt = lastUsedAt;
    }

    @Override
    public String toString() {
        return kind + " " + url;
    }
}
