package com.txarchive.ingestion.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txarchive.common.RetryPolicy;
import com.txarchive.domain.RetentionPolicy;
import com.txarchive.domain.TransactionBatch;
import com.txarchive.domain.TransactionNotice;
import com.txarchive.domain.TransactionRecord;
import com.txarchive.ingestion.adapter.RpcException;
import com.txarchive.ingestion.adapter.SolanaRpcClient;
import com.txarchive.ingestion.endpoint.EndpointExhaustedException;
import com.txarchive.ingestion.endpoint.EndpointKind;
import com.txarchive.ingestion.endpoint.EndpointLease;
import com.txarchive.ingestion.endpoint.EndpointOutcome;
import com.txarchive.ingestion.endpoint.EndpointPool;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Resolves batch entries into full transaction records with getTransaction.
 * <p>
 * Each attempt leases one request/response connection from the pool and releases it as soon as the call
 * ends. A failed attempt is reported to the pool and retried on the next pool-selected endpoint, up to the
 * retry policy's attempt limit. An invalid-params error fails the signature at once without counting against the
 * endpoint. {@code result: null} means the chain does not have the signature: terminal,
 * not retried. Failing to lease (busy or nothing healthy) idles and tries again without using up an attempt.
 */
@Slf4j
public class TransactionDetailFetcher {

    /** JSON-RPC "Invalid params". */
    static final int INVALID_PARAMS = -32602;

    private final EndpointPool pool;
    private final SolanaRpcClient rpcClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final RetentionPolicy retentionPolicy;
    private final Duration requestTimeout;
    private final Duration exhaustedIdleDelay;
    private final int parallelism;
    private final Map<String, Object> requestConfig;
    private final Clock clock;
    private final FetchStats stats = new FetchStats();

    public TransactionDetailFetcher(EndpointPool pool, SolanaRpcClient rpcClient, ObjectMapper objectMapper,
                                    RateLimiter rateLimiter, RetryPolicy retryPolicy, RetentionPolicy retentionPolicy,
                                    FetchSettings settings, Clock clock) {
        this.pool = pool;
        this.rpcClient = rpcClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.retentionPolicy = retentionPolicy;
        this.requestTimeout = settings.requestTimeout();
        this.exhaustedIdleDelay = settings.exhaustedIdleDelay();
        this.parallelism = Math.max(1, Math.min(settings.parallelism(), pool.getMaxConnections()));
        this.requestConfig = Map.of(
                "encoding", settings.encoding(),
                "commitment", settings.commitment(),
                "maxSupportedTransactionVersion", 0);
        this.clock = clock;
    }

    /**
     * Resolve every notice of the batch with bounded parallelism. Outcomes arrive in completion order;
     * one signature's failure never stops the others.
     */
    public Flux<FetchOutcome> resolve(TransactionBatch batch) {
        return Flux.fromIterable(batch.notices())
                .flatMap(this::resolveOne, parallelism)
                .doOnNext(stats::record);
    }

    public Mono<FetchOutcome> resolveOne(TransactionNotice notice) {
        return attempt(notice, 1);
    }

    public FetchStats getStats() {
        return stats;
    }

    private Mono<FetchOutcome> attempt(TransactionNotice notice, int attempt) {
        return leaseWhenAvailable()
                .flatMap(lease -> callOnce(lease, notice, attempt))
                .onErrorResume(RpcException.class, e -> {
                    if (attempt >= retryPolicy.getMaxAttempts()) {
                        log.warn("getTransaction {} failed after {} attempt(s): {}", notice.signature(), attempt, e.getMessage());
                        return Mono.just(FetchOutcome.failed(notice.signature(), attempt, e));
                    }
                    stats.retried();
                    long delayMs = retryPolicy.delayMs(attempt - 1);
                    log.debug("getTransaction {} attempt {} failed ({}); retrying in {} ms",
                            notice.signature(), attempt, e.getMessage(), delayMs);
                    return Mono.delay(Duration.ofMillis(delayMs))
                            .then(Mono.defer(() -> attempt(notice, attempt + 1)));
                });
    }

    private Mono<EndpointLease> leaseWhenAvailable() {
        return Mono.defer(this::throttle)
                .then(Mono.fromCallable(() -> pool.acquire(EndpointKind.REQUEST_RESPONSE)))
                .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, exhaustedIdleDelay)
                        .filter(EndpointExhaustedException.class::isInstance)
                        .doBeforeRetry(signal -> {
                            if (signal.totalRetriesInARow() % 30 == 0) {
                                log.warn("No request/response connection available ({}); waiting",
                                        signal.failure().getMessage());
                            }
                        }));
    }

    private Mono<Void> throttle() {
        long waitNanos = rateLimiter.reservePermission();
        if (waitNanos < 0) {
            return Mono.error(new EndpointExhaustedException(EndpointExhaustedException.Reason.BUSY,
                    EndpointKind.REQUEST_RESPONSE, "Local request rate limit reached"));
        }
        return waitNanos == 0 ? Mono.empty() : Mono.delay(Duration.ofNanos(waitNanos)).then();
    }

    private Mono<FetchOutcome> callOnce(EndpointLease lease, TransactionNotice notice, int attempt) {
        String signature = notice.signature();
        return rpcClient.call(lease.url(), "getTransaction", List.of(signature, requestConfig))
                .timeout(requestTimeout)
                .switchIfEmpty(Mono.error(() -> new RpcException("Empty getTransaction response from " + lease.url())))
                .map(json -> toOutcome(notice, json, attempt))
                .onErrorMap(e -> !(e instanceof RpcException),
                        e -> new RpcException("getTransaction " + signature + " via " + lease.url() + " failed: " + e, e))
                .doOnNext(outcome -> pool.report(lease.endpoint(), EndpointOutcome.SUCCESS))
                .doOnError(e -> pool.report(lease.endpoint(), EndpointOutcome.FAILURE))
                .doFinally(signal -> lease.close());
    }

    private FetchOutcome toOutcome(TransactionNotice notice, String json, int attempt) {
        JsonNode root = readTree(json);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            if (error.path("code").asInt() == INVALID_PARAMS) {
                log.warn("getTransaction rejected {} as invalid, not retrying: {}", notice.signature(), error);
                return FetchOutcome.failed(notice.signature(), attempt, new RpcException("getTransaction invalid params: " + error));
            }
            throw new RpcException("getTransaction error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode()) {
            throw new RpcException("getTransaction response without result");
        }
        if (result.isNull()) {
            log.info("Transaction {} not found (pruned or never landed), skipping", notice.signature());
            return FetchOutcome.notFound(notice.signature(), attempt);
        }
        Instant fetchedAt = clock.instant();
        JsonNode blockTime = result.path("blockTime");
        TransactionRecord record = new TransactionRecord();
        record.setSignature(notice.signature());
        record.setSlot(result.path("slot").asLong(notice.slot()));
        record.setBlockTime(blockTime.isIntegralNumber() ? blockTime.asLong() : null);
        record.setPayload(result.toString().getBytes(StandardCharsets.UTF_8));
        record.setFetchedAt(fetchedAt);
        record.setRetentionExpiry(retentionPolicy.expiryFor(fetchedAt).orElse(null));
        return FetchOutcome.fetched(record, attempt);
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Unparseable getTransaction response: " + e.getOriginalMessage(), e);
        }
    }
}
