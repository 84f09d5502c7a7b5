package com.txarchive.ingestion.pipeline;

/**
 * Per-batch tally of what happened to each signature.
 */
public record BatchSummary(int size, int stored, int notFound, int failed) {

    enum Entry {
        STORED,
        NOT_FOUND,
        FAILED
    }

    static BatchSummary empty(int size) {
        return new BatchSummary(size, 0, 0, 0);
    }

    BatchSummary add(Entry entry) {
        return switch (entry) {
            case STORED -> new BatchSummary(size, stored + 1, notFound, failed);
            case NOT_FOUND -> new BatchSummary(size, stored, notFound + 1, failed);
            case FAILED -> new BatchSummary(size, stored, notFound, failed + 1);
        };
    }
}
