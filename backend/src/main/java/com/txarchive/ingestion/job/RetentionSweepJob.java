package com.txarchive.ingestion.job;

import com.txarchive.domain.RetentionPolicy;
import com.txarchive.ingestion.pipeline.IngestionOrchestrator;
import com.txarchive.store.StorageCorruptionException;
import com.txarchive.store.StorageException;
import com.txarchive.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Deletes records past their retention expiry. Runs at startup and then every sweep interval.
 * Unbounded retention (0 days) turns the sweep into a no-op.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionSweepJob {

    private final TransactionStore transactionStore;
    private final RetentionPolicy retentionPolicy;
    private final IngestionOrchestrator orchestrator;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${txarchive.storage.sweep-interval-ms:3600000}")
    public void runScheduled() {
        sweep();
    }

    /**
     * @return number of records removed in this run
     */
    public long sweep() {
        if (retentionPolicy.isUnbounded()) {
            log.debug("Retention unbounded, sweep skipped");
            return 0;
        }
        try {
            long removed = transactionStore.sweepExpired(clock.instant());
            if (removed > 0) {
                log.info("Retention sweep removed {} expired transaction(s)", removed);
            } else {
                log.debug("Retention sweep found nothing to remove");
            }
            return removed;
        } catch (StorageCorruptionException e) {
            orchestrator.halt(e);
            return 0;
        } catch (StorageException e) {
            log.warn("Retention sweep failed, retrying next cycle: {}", e.getMessage(), e);
            return 0;
        }
    }
}
