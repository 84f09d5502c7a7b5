package com.txarchive.ingestion.stream;

import com.txarchive.ingestion.endpoint.Endpoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-endpoint subscription state. Transitions follow {@link StreamState#canTransitionTo}; anything else is refused.
 */
@Slf4j
public class StreamConnection {

    private final Endpoint endpoint;
    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.DISCONNECTED);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicInteger consecutiveReadErrors = new AtomicInteger();
    private volatile Instant lastFrameAt = Instant.EPOCH;
    private volatile Long subscriptionId;

    public StreamConnection(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * @return true when the state changed or already was {@code next}
     */
    public boolean transition(StreamState next) {
        while (true) {
            StreamState current = state.get();
            if (current == next) {
                return true;
            }
            if (!current.canTransitionTo(next)) {
                log.debug("Ignoring {} -> {} on {}", current, next, endpoint.getUrl());
                return false;
            }
            if (state.compareAndSet(current, next)) {
                log.debug("Stream {}: {} -> {}", endpoint.getUrl(), current, next);
                return true;
            }
        }
    }

    void markDisconnected() {
        state.set(StreamState.DISCONNECTED);
        subscriptionId = null;
    }

    void onConnecting(Instant now) {
        lastFrameAt = now;
        consecutiveReadErrors.set(0);
        subscriptionId = null;
    }

    void onSubscribed(Long id) {
        subscriptionId = id;
        reconnectAttempts.set(0);
    }

    void onFrame(Instant now) {
        lastFrameAt = now;
    }

    void onGoodFrame() {
        consecutiveReadErrors.set(0);
    }

    int onReadError() {
        return consecutiveReadErrors.incrementAndGet();
    }

    int nextReconnectAttempt() {
        return reconnectAttempts.getAndIncrement();
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public String getUrl() {
        return endpoint.getUrl();
    }

    public StreamState getState() {
        return state.get();
    }

    public Instant getLastFrameAt() {
        return lastFrameAt;
    }

    public Long getSubscriptionId() {
        return subscriptionId;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }
}
