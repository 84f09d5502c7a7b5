package com.txarchive.ingestion.batch;

import com.txarchive.domain.TransactionBatch;
import com.txarchive.domain.TransactionNotice;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drops duplicate notices and groups the rest into batches. A batch is emitted when it reaches
 * {@code maxBatchSize} or {@code flushTimeout} after its first notice, whichever comes first; an empty
 * window emits nothing. When the notice stream completes the partial batch is flushed. Batches are only
 * cut on demand, so a slow consumer pushes back on the notice buffer instead of overflowing.
 */
@Slf4j
public class NoticeBatcher {

    private final SignatureDeduplicator deduplicator;
    private final int maxBatchSize;
    private final Duration flushTimeout;
    private final AtomicLong duplicates = new AtomicLong();

    public NoticeBatcher(SignatureDeduplicator deduplicator, int maxBatchSize, Duration flushTimeout) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
        this.deduplicator = deduplicator;
        this.maxBatchSize = maxBatchSize;
        this.flushTimeout = flushTimeout;
    }

    public Flux<TransactionBatch> batches(Flux<TransactionNotice> notices) {
        return notices
                .filter(this::firstSighting)
                .bufferTimeout(maxBatchSize, flushTimeout, true)
                .filter(buffer -> !buffer.isEmpty())
                .map(TransactionBatch::new);
    }

    public long getDuplicates() {
        return duplicates.get();
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    private boolean firstSighting(TransactionNotice notice) {
        if (deduplicator.markFirstSeen(notice.signature())) {
            return true;
        }
        duplicates.incrementAndGet();
        log.debug("Duplicate notice {} from {}", notice.signature(), notice.sourceUrl());
        return false;
    }
}
