package com.txarchive.ingestion.stream;

import com.txarchive.common.RetryPolicy;
import com.txarchive.domain.TransactionNotice;
import com.txarchive.ingestion.adapter.RpcException;
import com.txarchive.ingestion.adapter.SolanaStreamClient;
import com.txarchive.ingestion.adapter.SubscriptionRejectedException;
import com.txarchive.ingestion.endpoint.EndpointExhaustedException;
import com.txarchive.ingestion.endpoint.EndpointKind;
import com.txarchive.ingestion.endpoint.EndpointLease;
import com.txarchive.ingestion.endpoint.EndpointOutcome;
import com.txarchive.ingestion.endpoint.EndpointPool;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.publisher.SynchronousSink;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns one logsSubscribe stream per streaming endpoint and merges their notices into a single Flux.
 * Each stream runs its own reconnect loop; notices from different endpoints are not deduplicated here.
 * <p>
 * One-shot lifecycle: {@link #start()} opens every stream, {@link #stop()} cancels in-flight reads and
 * backoff sleeps without awaiting them and completes {@link #notices()}.
 */
@Slf4j
public class SubscriptionManager {

    private final EndpointPool pool;
    private final SolanaStreamClient streamClient;
    private final LogsSubscriptionCodec codec;
    private final RetryPolicy reconnectPolicy;
    private final Duration connectTimeout;
    private final Duration idleTimeout;
    private final int maxReadErrors;
    private final Clock clock;
    private final List<StreamConnection> connections;
    private final Sinks.Many<TransactionNotice> sink;
    private final Object emitLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong droppedNotices = new AtomicLong();
    private final Disposable.Composite sessions = Disposables.composite();

    public SubscriptionManager(EndpointPool pool, SolanaStreamClient streamClient, LogsSubscriptionCodec codec,
                               RetryPolicy reconnectPolicy, Duration connectTimeout, Duration idleTimeout,
                               int maxReadErrors, int noticeBufferSize, Clock clock) {
        this.pool = pool;
        this.streamClient = streamClient;
        this.codec = codec;
        this.reconnectPolicy = reconnectPolicy;
        this.connectTimeout = connectTimeout;
        this.idleTimeout = idleTimeout;
        this.maxReadErrors = maxReadErrors;
        this.clock = clock;
        this.connections = pool.getEndpoints(EndpointKind.STREAMING).stream().map(StreamConnection::new).toList();
        this.sink = Sinks.many().multicast().onBackpressureBuffer(noticeBufferSize, false);
    }

    /**
     * Merged notices of all streams, in receipt order per endpoint. Completes after {@link #stop()}.
     */
    public Flux<TransactionNotice> notices() {
        return sink.asFlux();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting {} stream subscription(s)", connections.size());
        for (StreamConnection connection : connections) {
            sessions.add(connectionLoop(connection).subscribe(
                    null,
                    e -> log.error("Stream loop for {} terminated: {}", connection.getUrl(), e.getMessage(), e)));
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        sessions.dispose();
        connections.forEach(StreamConnection::markDisconnected);
        synchronized (emitLock) {
            sink.tryEmitComplete();
        }
        log.info("Stream subscriptions stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public Map<String, StreamState> connectionStates() {
        Map<String, StreamState> states = new LinkedHashMap<>();
        connections.forEach(c -> states.put(c.getUrl(), c.getState()));
        return states;
    }

    public long getDroppedNotices() {
        return droppedNotices.get();
    }

    List<StreamConnection> getConnections() {
        return connections;
    }

    private Mono<Void> connectionLoop(StreamConnection connection) {
        return Mono.defer(() -> runSession(connection))
                .doOnSuccess(ignored -> {
                    if (running.get()) {
                        log.info("Stream {} closed by server", connection.getUrl());
                    }
                })
                .onErrorResume(e -> {
                    onSessionFailure(connection, e);
                    return Mono.empty();
                })
                .then(Mono.defer(() -> backoff(connection)))
                .repeat(running::get)
                .then();
    }

    private Mono<Void> runSession(StreamConnection connection) {
        EndpointLease lease = pool.acquire(connection.getEndpoint());
        connection.transition(StreamState.CONNECTING);
        connection.onConnecting(clock.instant());
        log.info("Connecting to {}", connection.getUrl());

        Mono<Void> reading = streamClient.stream(connection.getUrl(), codec.subscribeRequest())
                .doOnNext(frame -> onFrame(connection, lease, frame))
                .then();
        // Only the subscribe acknowledgement ends the handshake; other early frames do not count.
        Mono<Void> handshake = Mono.delay(connectTimeout)
                .then(Mono.defer(() -> connection.getState() == StreamState.CONNECTING
                        ? Mono.<Void>error(new RpcException("No logsSubscribe acknowledgement from "
                        + connection.getUrl() + " within " + connectTimeout))
                        : Mono.<Void>never()));
        Mono<Void> liveness = Flux.interval(idleTimeout, idleTimeout)
                .<Void>handle((tick, out) -> checkLiveness(connection, out))
                .then();

        return Mono.firstWithSignal(reading, handshake, liveness)
                .doFinally(signal -> lease.close());
    }

    private void onFrame(StreamConnection connection, EndpointLease lease, String frame) {
        connection.onFrame(clock.instant());
        StreamFrame decoded = codec.decode(frame, connection.getUrl());
        switch (decoded.type()) {
            case SUBSCRIBED -> {
                if (connection.transition(StreamState.SUBSCRIBED)) {
                    connection.onSubscribed(decoded.subscriptionId());
                    pool.report(lease.endpoint(), EndpointOutcome.SUCCESS);
                    log.info("Subscribed to {} (subscription {})", connection.getUrl(), decoded.subscriptionId());
                }
            }
            case REJECTED -> throw new SubscriptionRejectedException(
                    "logsSubscribe rejected by " + connection.getUrl() + ": " + decoded.detail());
            case NOTICE -> {
                recover(connection);
                if (connection.getState().isLive()) {
                    emit(connection, decoded.notice());
                } else {
                    log.debug("Notice {} from {} before subscribe acknowledgement, ignored",
                            decoded.notice().signature(), connection.getUrl());
                }
            }
            case SKIPPED -> {
                recover(connection);
                log.debug("Skipping failed transaction {} from {}", decoded.detail(), connection.getUrl());
            }
            case IGNORED -> recover(connection);
            case UNREADABLE -> {
                int errors = connection.onReadError();
                if (connection.getState() == StreamState.SUBSCRIBED) {
                    connection.transition(StreamState.DEGRADED);
                    log.warn("Stream {} degraded: {}", connection.getUrl(), decoded.detail());
                } else {
                    log.debug("Unreadable frame from {}: {}", connection.getUrl(), decoded.detail());
                }
                if (errors >= maxReadErrors) {
                    throw new RpcException(errors + " consecutive unreadable frames from " + connection.getUrl());
                }
            }
        }
    }

    private void recover(StreamConnection connection) {
        connection.onGoodFrame();
        if (connection.getState() == StreamState.DEGRADED && connection.transition(StreamState.SUBSCRIBED)) {
            log.info("Stream {} recovered", connection.getUrl());
        }
    }

    private void checkLiveness(StreamConnection connection, SynchronousSink<Void> out) {
        Duration silence = Duration.between(connection.getLastFrameAt(), clock.instant());
        if (connection.getState() == StreamState.SUBSCRIBED && silence.compareTo(idleTimeout) > 0) {
            connection.transition(StreamState.DEGRADED);
            log.warn("Stream {} degraded: no frames for {}", connection.getUrl(), silence);
        } else if (connection.getState() == StreamState.DEGRADED && silence.compareTo(idleTimeout.multipliedBy(2)) > 0) {
            out.error(new RpcException("No frames from " + connection.getUrl() + " for " + silence));
        }
    }

    private void emit(StreamConnection connection, TransactionNotice notice) {
        Sinks.EmitResult result;
        synchronized (emitLock) {
            result = sink.tryEmitNext(notice);
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            droppedNotices.incrementAndGet();
            log.warn("Notice buffer full, dropped {} from {}", notice.signature(), connection.getUrl());
        } else if (result.isFailure()) {
            log.debug("Notice {} not emitted: {}", notice.signature(), result);
        }
    }

    private void onSessionFailure(StreamConnection connection, Throwable e) {
        if (!running.get()) {
            return;
        }
        if (e instanceof SubscriptionRejectedException) {
            pool.reject(connection.getEndpoint());
            log.error("Subscription refused by {}: {}", connection.getUrl(), e.getMessage());
        } else if (e instanceof EndpointExhaustedException) {
            log.debug("Stream endpoint {} not available: {}", connection.getUrl(), e.getMessage());
        } else {
            pool.report(connection.getEndpoint(), EndpointOutcome.FAILURE);
            log.warn("Stream {} failed in state {}: {}", connection.getUrl(), connection.getState(), e.getMessage());
        }
    }

    private Mono<Void> backoff(StreamConnection connection) {
        if (!running.get()) {
            return Mono.empty();
        }
        if (connection.getState() != StreamState.DISCONNECTED) {
            connection.transition(StreamState.RECONNECTING);
        }
        int attempt = connection.nextReconnectAttempt();
        long delayMs = reconnectPolicy.delayMs(attempt);
        log.info("Reconnecting to {} in {} ms (attempt {})", connection.getUrl(), delayMs, attempt + 1);
        return Mono.delay(Duration.ofMillis(delayMs))
                .doFinally(signal -> connection.transition(StreamState.DISCONNECTED))
                .then();
    }
}
