package com.txarchive.ingestion.endpoint;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One leased connection slot on an endpoint. Closing returns the slot to the pool; closing twice is a no-op.
 */
public final class EndpointLease implements AutoCloseable {

    private final EndpointPool pool;
    private final Endpoint endpoint;
    private final AtomicBoolean released = new AtomicBoolean(false);

    EndpointLease(EndpointPool pool, Endpoint endpoint) {
        this.pool = pool;
        this.endpoint = endpoint;
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    public String url() {
        return endpoint.getUrl();
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(this);
        }
    }
}
