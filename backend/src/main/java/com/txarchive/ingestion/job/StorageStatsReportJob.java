package com.txarchive.ingestion.job;

import com.txarchive.domain.StorageStats;
import com.txarchive.ingestion.batch.NoticeBatcher;
import com.txarchive.ingestion.endpoint.EndpointPool;
import com.txarchive.ingestion.fetch.FetchStats;
import com.txarchive.ingestion.fetch.TransactionDetailFetcher;
import com.txarchive.ingestion.stream.SubscriptionManager;
import com.txarchive.store.StorageException;
import com.txarchive.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Periodic one-line report of archive size and ingestion counters.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageStatsReportJob {

    private static final double MB = 1024.0 * 1024.0;

    private final TransactionStore transactionStore;
    private final TransactionDetailFetcher fetcher;
    private final NoticeBatcher batcher;
    private final SubscriptionManager subscriptionManager;
    private final EndpointPool endpointPool;

    @Scheduled(
            fixedRateString = "${txarchive.storage.stats-interval-ms:30000}",
            initialDelayString = "${txarchive.storage.stats-interval-ms:30000}")
    public void runScheduled() {
        report();
    }

    String report() {
        StorageStats stats;
        try {
            stats = transactionStore.stats();
        } catch (StorageException e) {
            log.warn("Storage stats unavailable: {}", e.getMessage());
            return null;
        }
        FetchStats fetch = fetcher.getStats();
        String line = String.format(Locale.ROOT, "transactions: %d, size: %.2f MB, fetched: %d, not found: %d, failed: %d, "
                        + "duplicates: %d, dropped notices: %d, leased connections: %d/%d",
                stats.transactionCount(), stats.sizeBytes() / MB, fetch.getFetched(), fetch.getNotFound(),
                fetch.getFailed(), batcher.getDuplicates(), subscriptionManager.getDroppedNotices(),
                endpointPool.leasedConnections(), endpointPool.getMaxConnections());
        log.info("Archive stats - {}", line);
        return line;
    }
}
