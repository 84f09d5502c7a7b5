package com.txarchive.ingestion.pipeline;

import com.txarchive.domain.TransactionRecord;
import com.txarchive.store.StorageCorruptionException;
import com.txarchive.store.StorageException;
import com.txarchive.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves fetched records into the store on a dedicated writer executor.
 * <p>
 * Recoverable {@link StorageException}s are retried with exponential backoff; when attempts run out the
 * record is dropped and counted. {@link StorageCorruptionException} is never retried and propagates so the
 * orchestrator can halt. A write that has started runs to completion even if the caller cancels.
 */
@Slf4j
public class StorageWriter {

    private final TransactionStore store;
    private final Executor writerExecutor;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final AtomicLong stored = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public StorageWriter(TransactionStore store, Executor writerExecutor, int maxAttempts,
                         Duration baseDelay, Duration maxDelay, double jitterFactor) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.store = store;
        this.writerExecutor = writerExecutor;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
    }

    /**
     * @return true once stored, false when the record was dropped after recoverable failures
     */
    public Mono<Boolean> persist(TransactionRecord record) {
        String signature = record.getSignature();
        return Mono.fromFuture(() -> CompletableFuture.runAsync(() -> store.upsert(record), writerExecutor), true)
                .onErrorMap(CompletionException.class, e -> e.getCause() != null ? e.getCause() : e)
                .thenReturn(Boolean.TRUE)
                .retryWhen(Retry.backoff(maxAttempts - 1L, baseDelay)
                        .maxBackoff(maxDelay)
                        .jitter(jitterFactor)
                        .filter(StorageWriter::isRecoverable)
                        .doBeforeRetry(signal -> log.warn("Write of {} failed (attempt {}): {}",
                                signature, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .doOnNext(ok -> stored.incrementAndGet())
                .onErrorResume(StorageWriter::isRecoverable, e -> {
                    dropped.incrementAndGet();
                    log.error("Dropping {} after {} failed write attempt(s): {}", signature, maxAttempts, e.getMessage(), e);
                    return Mono.just(Boolean.FALSE);
                });
    }

    public long getStored() {
        return stored.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    private static boolean isRecoverable(Throwable e) {
        return e instanceof StorageException && !(e instanceof StorageCorruptionException);
    }
}
