package com.txarchive.ingestion.fetch;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running fetch counters, read by the status surface.
 */
public class FetchStats {

    private final AtomicLong fetched = new AtomicLong();
    private final AtomicLong notFound = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();

    void record(FetchOutcome outcome) {
        switch (outcome.status()) {
            case FETCHED -> fetched.incrementAndGet();
            case NOT_FOUND -> notFound.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
        }
    }

    void retried() {
        retries.incrementAndGet();
    }

    public long getFetched() {
        return fetched.get();
    }

    public long getNotFound() {
        return notFound.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long getRetries() {
        return retries.get();
    }
}
