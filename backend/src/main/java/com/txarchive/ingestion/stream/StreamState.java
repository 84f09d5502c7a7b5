package com.txarchive.ingestion.stream;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of one streaming subscription.
 * <pre>
 * DISCONNECTED -> CONNECTING -> SUBSCRIBED <-> DEGRADED
 * CONNECTING | SUBSCRIBED | DEGRADED -> RECONNECTING -> DISCONNECTED
 * CONNECTING | SUBSCRIBED | DEGRADED -> DISCONNECTED   (shutdown)
 * </pre>
 */
public enum StreamState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    DEGRADED,
    RECONNECTING;

    private static final Map<StreamState, Set<StreamState>> TRANSITIONS = new EnumMap<>(StreamState.class);

    static {
        TRANSITIONS.put(DISCONNECTED, EnumSet.of(CONNECTING));
        TRANSITIONS.put(CONNECTING, EnumSet.of(SUBSCRIBED, RECONNECTING, DISCONNECTED));
        TRANSITIONS.put(SUBSCRIBED, EnumSet.of(DEGRADED, RECONNECTING, DISCONNECTED));
        TRANSITIONS.put(DEGRADED, EnumSet.of(SUBSCRIBED, RECONNECTING, DISCONNECTED));
        TRANSITIONS.put(RECONNECTING, EnumSet.of(DISCONNECTED));
    }

    public boolean canTransitionTo(StreamState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isLive() {
        return this == SUBSCRIBED || this == DEGRADED;
    }
}
