package com.txarchive.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txarchive.common.RetryPolicy;
import com.txarchive.config.ExecutorConfig;
import com.txarchive.domain.RetentionPolicy;
import com.txarchive.ingestion.adapter.ReactorNettySolanaStreamClient;
import com.txarchive.ingestion.adapter.SolanaRpcClient;
import com.txarchive.ingestion.adapter.SolanaStreamClient;
import com.txarchive.ingestion.adapter.WebClientSolanaRpcClient;
import com.txarchive.ingestion.batch.NoticeBatcher;
import com.txarchive.ingestion.batch.SignatureDeduplicator;
import com.txarchive.ingestion.endpoint.Endpoint;
import com.txarchive.ingestion.endpoint.EndpointKind;
import com.txarchive.ingestion.endpoint.EndpointPool;
import com.txarchive.ingestion.fetch.FetchSettings;
import com.txarchive.ingestion.fetch.TransactionDetailFetcher;
import com.txarchive.ingestion.pipeline.IngestionOrchestrator;
import com.txarchive.ingestion.pipeline.StorageWriter;
import com.txarchive.ingestion.stream.LogsSubscriptionCodec;
import com.txarchive.ingestion.stream.SubscriptionManager;
import com.txarchive.store.StorageProperties;
import com.txarchive.store.TransactionStore;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Wires the ingestion engine: one shared endpoint pool, stream subscriptions, dedup and batching,
 * detail fetch and the storage writer, driven by {@link IngestionOrchestrator}.
 */
@Configuration
@EnableConfigurationProperties({ ArchiveNetworkProperties.class, ArchiveNodeProperties.class, IngestionRetryProperties.class,
        CircuitBreakerProperties.class, StreamProperties.class, FetchProperties.class })
public class IngestionConfig {

    private static final Set<String> RPC_SCHEMES = Set.of("http", "https");
    private static final Set<String> STREAM_SCHEMES = Set.of("ws", "wss");

    private static RetryPolicy retryPolicy(IngestionRetryProperties retry) {
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean
    public EndpointPool endpointPool(ArchiveNetworkProperties network, CircuitBreakerProperties breaker, Clock clock) {
        validate(network);
        List<Endpoint> endpoints = new ArrayList<>();
        network.getRpcEndpoints().forEach(url ->
                endpoints.add(new Endpoint(url, EndpointKind.REQUEST_RESPONSE, network.getEndpointWeights().getOrDefault(url, 1))));
        network.getWebsocketEndpoints().forEach(url ->
                endpoints.add(new Endpoint(url, EndpointKind.STREAMING, network.getEndpointWeights().getOrDefault(url, 1))));
        RetryPolicy backoff = new RetryPolicy(breaker.getBaseBackoffMs(), breaker.getMaxBackoffMs(), breaker.getJitterFactor(), 1);
        return new EndpointPool(endpoints, network.getMaxConnections(), breaker.getFailureThreshold(),
                Duration.ofMillis(breaker.getFailureWindowMs()), backoff, clock);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientSolanaRpcClient(webClientBuilder);
    }

    @Bean
    public SolanaStreamClient solanaStreamClient() {
        return new ReactorNettySolanaStreamClient();
    }

    @Bean
    public LogsSubscriptionCodec logsSubscriptionCodec(ObjectMapper objectMapper, Clock clock, StreamProperties stream) {
        return new LogsSubscriptionCodec(objectMapper, clock, stream.getCommitment(), stream.isIncludeVotes(), stream.isSkipFailed());
    }

    @Bean
    public SubscriptionManager subscriptionManager(EndpointPool endpointPool, SolanaStreamClient streamClient,
                                                   LogsSubscriptionCodec codec, IngestionRetryProperties retry,
                                                   StreamProperties stream, Clock clock) {
        return new SubscriptionManager(endpointPool, streamClient, codec, retryPolicy(retry),
                Duration.ofMillis(stream.getConnectTimeoutMs()), Duration.ofMillis(stream.getIdleTimeoutMs()),
                stream.getMaxReadErrors(), stream.getNoticeBufferSize(), clock);
    }

    /** Dedup window never shorter than the flush timeout, so a batch never holds the same signature twice. */
    @Bean
    public SignatureDeduplicator signatureDeduplicator(StreamProperties stream, ArchiveNodeProperties node) {
        long ttlMs = Math.max(stream.getDedupTtlMs(), node.getFlushTimeoutMs());
        return new SignatureDeduplicator(Duration.ofMillis(ttlMs), stream.getDedupMaxSize());
    }

    @Bean
    public NoticeBatcher noticeBatcher(SignatureDeduplicator deduplicator, ArchiveNodeProperties node) {
        return new NoticeBatcher(deduplicator, node.getMaxTransactionBatchSize(), Duration.ofMillis(node.getFlushTimeoutMs()));
    }

    @Bean
    public RetentionPolicy retentionPolicy(ArchiveNodeProperties node) {
        return new RetentionPolicy(node.getStorageRetentionDays());
    }

    @Bean(name = "solanaRpcRateLimiter")
    public RateLimiter solanaRpcRateLimiter(FetchProperties fetch) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, fetch.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, fetch.getRateLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public TransactionDetailFetcher transactionDetailFetcher(EndpointPool endpointPool, SolanaRpcClient rpcClient,
                                                             ObjectMapper objectMapper,
                                                             @Qualifier("solanaRpcRateLimiter") RateLimiter rateLimiter,
                                                             IngestionRetryProperties retry, RetentionPolicy retentionPolicy,
                                                             FetchProperties fetch, StreamProperties stream, Clock clock) {
        FetchSettings settings = new FetchSettings(Duration.ofMillis(fetch.getRequestTimeoutMs()), fetch.getParallelism(),
                fetch.getEncoding(), stream.getCommitment(), Duration.ofMillis(fetch.getExhaustedIdleDelayMs()));
        return new TransactionDetailFetcher(endpointPool, rpcClient, objectMapper, rateLimiter, retryPolicy(retry),
                retentionPolicy, settings, clock);
    }

    @Bean
    public StorageWriter storageWriter(TransactionStore transactionStore,
                                       @Qualifier(ExecutorConfig.STORAGE_WRITER_EXECUTOR) Executor writerExecutor,
                                       StorageProperties storage) {
        return new StorageWriter(transactionStore, writerExecutor, storage.getWriteMaxAttempts(),
                Duration.ofMillis(storage.getWriteBaseDelayMs()), Duration.ofMillis(storage.getWriteMaxDelayMs()),
                storage.getWriteJitterFactor());
    }

    @Bean
    public IngestionOrchestrator ingestionOrchestrator(SubscriptionManager subscriptionManager, NoticeBatcher noticeBatcher,
                                                       TransactionDetailFetcher fetcher, StorageWriter storageWriter,
                                                       EndpointPool endpointPool, ArchiveNodeProperties node,
                                                       ArchiveNetworkProperties network) {
        return new IngestionOrchestrator(subscriptionManager, noticeBatcher, fetcher, storageWriter, endpointPool,
                Duration.ofMillis(node.getDrainTimeoutMs()), node.isAutoStart(),
                network.getGossipEntrypoints(), node.getIdentityKeypairPath());
    }

    /**
     * Cross-field checks bean validation cannot express.
     *
     * @throws ArchiveConfigurationException on a bad URL scheme or a connection cap that leaves no room for fetches
     */
    static void validate(ArchiveNetworkProperties network) {
        network.getRpcEndpoints().forEach(url -> requireScheme(url, RPC_SCHEMES, "rpc-endpoints"));
        network.getWebsocketEndpoints().forEach(url -> requireScheme(url, STREAM_SCHEMES, "websocket-endpoints"));
        int streams = network.getWebsocketEndpoints().size();
        if (network.getMaxConnections() <= streams) {
            throw new ArchiveConfigurationException("max-connections (" + network.getMaxConnections()
                    + ") must exceed the number of websocket endpoints (" + streams + ")");
        }
        network.getEndpointWeights().forEach((url, weight) -> {
            if (weight == null || weight < 1) {
                throw new ArchiveConfigurationException("endpoint weight for " + url + " must be >= 1");
            }
        });
    }

    private static void requireScheme(String url, Set<String> allowed, String key) {
        String scheme;
        try {
            scheme = URI.create(url).getScheme();
        } catch (IllegalArgumentException e) {
            throw new ArchiveConfigurationException(key + ": malformed URL '" + url + "'");
        }
        if (scheme == null || !allowed.contains(scheme.toLowerCase())) {
            throw new ArchiveConfigurationException(key + ": '" + url + "' must use one of " + allowed);
        }
    }
}
