package com.txarchive.ingestion.pipeline;

import com.txarchive.domain.TransactionBatch;
import com.txarchive.ingestion.batch.NoticeBatcher;
import com.txarchive.ingestion.endpoint.EndpointPool;
import com.txarchive.ingestion.fetch.FetchOutcome;
import com.txarchive.ingestion.fetch.TransactionDetailFetcher;
import com.txarchive.ingestion.stream.SubscriptionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs notices through dedup and batching, detail fetch and storage.
 * <p>
 * Batches are processed one at a time; signatures inside a batch are fetched concurrently. Shutdown stops
 * intake first, then waits up to the drain timeout for in-flight batches before cancelling them, and finally
 * closes the endpoint pool. Storage corruption (or any other error escaping the pipeline) halts ingestion.
 */
@Slf4j
public class IngestionOrchestrator implements SmartLifecycle {

    public enum State {
        NEW,
        RUNNING,
        STOPPING,
        STOPPED,
        HALTED
    }

    private final SubscriptionManager subscriptionManager;
    private final NoticeBatcher batcher;
    private final TransactionDetailFetcher fetcher;
    private final StorageWriter writer;
    private final EndpointPool pool;
    private final Duration drainTimeout;
    private final boolean autoStart;
    private final List<String> gossipEntrypoints;
    private final String identityKeypairPath;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final CountDownLatch drained = new CountDownLatch(1);
    private volatile Disposable pipeline;
    private volatile Throwable haltCause;

    public IngestionOrchestrator(SubscriptionManager subscriptionManager, NoticeBatcher batcher,
                                 TransactionDetailFetcher fetcher, StorageWriter writer, EndpointPool pool,
                                 Duration drainTimeout, boolean autoStart,
                                 List<String> gossipEntrypoints, String identityKeypairPath) {
        this.subscriptionManager = subscriptionManager;
        this.batcher = batcher;
        this.fetcher = fetcher;
        this.writer = writer;
        this.pool = pool;
        this.drainTimeout = drainTimeout;
        this.autoStart = autoStart;
        this.gossipEntrypoints = gossipEntrypoints != null ? List.copyOf(gossipEntrypoints) : List.of();
        this.identityKeypairPath = identityKeypairPath;
    }

    @Override
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            return;
        }
        logPassthroughSettings();
        pipeline = batcher.batches(subscriptionManager.notices())
                .concatMap(this::process)
                .doFinally(signal -> drained.countDown())
                .subscribe(
                        summary -> { },
                        this::halt,
                        () -> log.info("Ingestion pipeline drained"));
        subscriptionManager.start();
        log.info("Ingestion started (batch size {}, {} connection(s) max)",
                batcher.getMaxBatchSize(), pool.getMaxConnections());
    }

    @Override
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPING)) {
            return;
        }
        log.info("Stopping ingestion: closing streams and draining in-flight batches");
        subscriptionManager.stop();
        if (!awaitDrain()) {
            log.warn("In-flight batches not drained within {}, cancelling remaining fetches", drainTimeout);
            Disposable running = pipeline;
            if (running != null) {
                running.dispose();
            }
        }
        pool.close();
        state.compareAndSet(State.STOPPING, State.STOPPED);
        log.info("Ingestion stopped ({} stored, {} dropped)", writer.getStored(), writer.getDropped());
    }

    /**
     * Stop intake after an unrecoverable error. The cause stays available through {@link #getHaltCause()}.
     */
    public void halt(Throwable cause) {
        State previous = state.getAndUpdate(s -> s == State.RUNNING || s == State.STOPPING ? State.HALTED : s);
        if (previous != State.RUNNING && previous != State.STOPPING) {
            return;
        }
        haltCause = cause;
        log.error("Ingestion halted: {}", cause.getMessage(), cause);
        subscriptionManager.stop();
        Disposable running = pipeline;
        if (running != null) {
            running.dispose();
        }
        pool.close();
    }

    @Override
    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    public State getState() {
        return state.get();
    }

    public Throwable getHaltCause() {
        return haltCause;
    }

    Mono<BatchSummary> process(TransactionBatch batch) {
        return fetcher.resolve(batch)
                .concatMap(this::store)
                .reduce(BatchSummary.empty(batch.size()), BatchSummary::add)
                .doOnNext(summary -> log.info("Batch of {}: {} stored, {} not found, {} failed",
                        summary.size(), summary.stored(), summary.notFound(), summary.failed()));
    }

    private Mono<BatchSummary.Entry> store(FetchOutcome outcome) {
        return switch (outcome.status()) {
            case FETCHED -> writer.persist(outcome.record())
                    .map(written -> written ? BatchSummary.Entry.STORED : BatchSummary.Entry.FAILED);
            case NOT_FOUND -> Mono.just(BatchSummary.Entry.NOT_FOUND);
            case FAILED -> Mono.just(BatchSummary.Entry.FAILED);
        };
    }

    private boolean awaitDrain() {
        try {
            return drained.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void logPassthroughSettings() {
        if (!gossipEntrypoints.isEmpty()) {
            log.info("Gossip entrypoints configured but not used by ingestion: {}", gossipEntrypoints);
        }
        if (identityKeypairPath != null && !identityKeypairPath.isBlank()) {
            log.info("Identity keypair path configured but not used by ingestion: {}", identityKeypairPath);
        }
    }
}
