package com.txarchive.ingestion.endpoint;

import com.txarchive.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Shared pool of request/response and streaming endpoints behind one connection cap.
 * <p>
 * Selection is smooth weighted round-robin over selectable endpoints of the requested kind; equal
 * weights tie-break on least-recently-used, then configuration order. Each endpoint carries its own
 * circuit breaker: {@code failureThreshold} failures inside {@code failureWindow} open it for an
 * exponentially growing, jittered and capped backoff, after which a single probe decides whether it
 * closes again. {@link #acquire} never blocks.
 */
@Slf4j
public class EndpointPool implements AutoCloseable {

    private final List<Endpoint> endpoints;
    private final int maxConnections;
    private final Semaphore permits;
    private final int failureThreshold;
    private final Duration failureWindow;
    private final RetryPolicy backoffPolicy;
    private final Clock clock;
    private final Object lock = new Object();
    private final Set<EndpointLease> activeLeases = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public EndpointPool(List<Endpoint> endpoints, int maxConnections, int failureThreshold,
                        Duration failureWindow, RetryPolicy backoffPolicy, Clock clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.endpoints = List.copyOf(endpoints);
        this.maxConnections = maxConnections;
        this.permits = new Semaphore(maxConnections);
        this.failureThreshold = failureThreshold;
        this.failureWindow = failureWindow;
        this.backoffPolicy = backoffPolicy != null ? backoffPolicy : RetryPolicy.defaultPolicy();
        this.clock = clock;
    }

    /**
     * Lease a connection on the next selectable endpoint of the given kind.
     *
     * @throws EndpointExhaustedException with {@code NO_HEALTHY_ENDPOINT} when nothing of that kind is
     *                                    selectable, {@code BUSY} when the connection cap is reached
     */
    public EndpointLease acquire(EndpointKind kind) {
        ensureOpen();
        Endpoint selected;
        synchronized (lock) {
            Instant now = clock.instant();
            // Permit first: a refused acquire must leave the round-robin weights untouched.
            takePermit(kind);
            selected = select(kind, now);
            if (selected == null) {
                permits.release();
                throw new EndpointExhaustedException(EndpointExhaustedException.Reason.NO_HEALTHY_ENDPOINT, kind,
                        "No healthy " + kind + " endpoint");
            }
            markLeased(selected, now);
        }
        return register(selected);
    }

    /**
     * Lease a connection on one specific endpoint (stream subscriptions are pinned to their endpoint).
     */
    public EndpointLease acquire(Endpoint endpoint) {
        ensureOpen();
        if (!endpoints.contains(endpoint)) {
            throw new IllegalArgumentException("Endpoint not managed by this pool: " + endpoint);
        }
        synchronized (lock) {
            Instant now = clock.instant();
            if (!isSelectable(endpoint, now)) {
                throw new EndpointExhaustedException(EndpointExhaustedException.Reason.NO_HEALTHY_ENDPOINT,
                        endpoint.getKind(), endpoint.getUrl() + " is " + endpoint.getHealth()
                        + " until " + endpoint.getNextEligibleAt());
            }
            takePermit(endpoint.getKind());
            markLeased(endpoint, now);
        }
        return register(endpoint);
    }

    /**
     * Feed the outcome of one call into the endpoint's circuit breaker.
     */
    public void report(Endpoint endpoint, EndpointOutcome outcome) {
        synchronized (lock) {
            Instant now = clock.instant();
            endpoint.probeInFlight = false;
            if (outcome == EndpointOutcome.SUCCESS) {
                endpoint.setConsecutiveFailures(0);
                if (endpoint.getHealth() == HealthState.DEGRADED) {
                    endpoint.setHealth(HealthState.HEALTHY);
                    endpoint.trips = 0;
                    endpoint.recentFailures.clear();
                    log.info("Endpoint {} recovered", endpoint);
                }
                return;
            }
            endpoint.setConsecutiveFailures(endpoint.getConsecutiveFailures() + 1);
            endpoint.recentFailures.addLast(now);
            Instant windowStart = now.minus(failureWindow);
            while (!endpoint.recentFailures.isEmpty() && endpoint.recentFailures.peekFirst().isBefore(windowStart)) {
                endpoint.recentFailures.removeFirst();
            }
            if (endpoint.getHealth() == HealthState.DEGRADED) {
                trip(endpoint, now, "probe failed");
            } else if (endpoint.getHealth() == HealthState.HEALTHY && endpoint.recentFailures.size() >= failureThreshold) {
                trip(endpoint, now, endpoint.recentFailures.size() + " failures within " + failureWindow);
            }
        }
    }

    /**
     * Permanent refusal (authentication or protocol rejection): open the breaker without waiting for the threshold.
     */
    public void reject(Endpoint endpoint) {
        synchronized (lock) {
            endpoint.probeInFlight = false;
            endpoint.setConsecutiveFailures(endpoint.getConsecutiveFailures() + 1);
            trip(endpoint, clock.instant(), "refused");
        }
    }

    public List<EndpointSnapshot> snapshot() {
        synchronized (lock) {
            List<EndpointSnapshot> out = new ArrayList<>(endpoints.size());
            for (Endpoint e : endpoints) {
                out.add(new EndpointSnapshot(e.getUrl(), e.getKind(), e.getHealth(), e.getConsecutiveFailures(),
                        e.trips, e.getNextEligibleAt(), e.inFlight));
            }
            return out;
        }
    }

    public List<Endpoint> getEndpoints(EndpointKind kind) {
        return endpoints.stream().filter(e -> e.getKind() == kind).toList();
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public int leasedConnections() {
        return maxConnections - permits.availablePermits();
    }

    /**
     * Release every outstanding lease. Further acquires fail.
     */
    @Override
    public void close() {
        closed = true;
        int outstanding = activeLeases.size();
        for (EndpointLease lease : List.copyOf(activeLeases)) {
            lease.close();
        }
        if (outstanding > 0) {
            log.info("Endpoint pool closed, released {} outstanding lease(s)", outstanding);
        }
    }

    void release(EndpointLease lease) {
        Endpoint endpoint = lease.endpoint();
        synchronized (lock) {
            endpoint.inFlight = Math.max(0, endpoint.inFlight - 1);
            endpoint.probeInFlight = false;
        }
        activeLeases.remove(lease);
        permits.release();
    }

    private Endpoint select(EndpointKind kind, Instant now) {
        List<Endpoint> candidates = new ArrayList<>();
        long totalWeight = 0;
        for (Endpoint e : endpoints) {
            if (e.getKind() == kind && isSelectable(e, now)) {
                candidates.add(e);
                totalWeight += e.getWeight();
            }
        }
        if (candidates.isEmpty()) {
            return null;
        }
        Endpoint best = null;
        for (Endpoint e : candidates) {
            e.currentWeight += e.getWeight();
            if (best == null
                    || e.currentWeight > best.currentWeight
                    || (e.currentWeight == best.currentWeight && e.getLastUsedAt().isBefore(best.getLastUsedAt()))) {
                best = e;
            }
        }
        best.currentWeight -= totalWeight;
        return best;
    }

    private boolean isSelectable(Endpoint e, Instant now) {
        if (e.getHealth() == HealthState.UNHEALTHY && !now.isBefore(e.getNextEligibleAt())) {
            e.setHealth(HealthState.DEGRADED);
            log.info("Endpoint {} backoff elapsed, probing", e);
        }
        return switch (e.getHealth()) {
            case HEALTHY -> true;
            case DEGRADED -> !e.probeInFlight;
            case UNHEALTHY -> false;
        };
    }

    private void takePermit(EndpointKind kind) {
        if (!permits.tryAcquire()) {
            throw new EndpointExhaustedException(EndpointExhaustedException.Reason.BUSY, kind,
                    "All " + maxConnections + " connections leased");
        }
    }

    private void markLeased(Endpoint e, Instant now) {
        e.setLastUsedAt(now);
        e.inFlight++;
        if (e.getHealth() == HealthState.DEGRADED) {
            e.probeInFlight = true;
        }
    }

    private EndpointLease register(Endpoint endpoint) {
        EndpointLease lease = new EndpointLease(this, endpoint);
        activeLeases.add(lease);
        return lease;
    }

    private void trip(Endpoint e, Instant now, String reason) {
        e.trips++;
        long delayMs = backoffPolicy.delayMs(e.trips - 1);
        e.setHealth(HealthState.UNHEALTHY);
        e.setNextEligibleAt(now.plusMillis(delayMs));
        e.recentFailures.clear();
        log.warn("Endpoint {} marked UNHEALTHY ({}); next probe in {} ms", e, reason, delayMs);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Endpoint pool is closed");
        }
    }
}
