package com.txarchive.ingestion.job;

import com.txarchive.domain.RetentionPolicy;
import com.txarchive.ingestion.pipeline.IngestionOrchestrator;
import com.txarchive.store.StorageCorruptionException;
import com.txarchive.store.StorageException;
import com.txarchive.store.TransactionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionSweepJobTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private TransactionStore store;

    @Mock
    private IngestionOrchestrator orchestrator;

    @Test
    void unboundedRetention_skipsSweep() {
        RetentionSweepJob job = new RetentionSweepJob(store, new RetentionPolicy(0), orchestrator, clock);

        assertThat(job.sweep()).isZero();
        verifyNoInteractions(store);
    }

    @Test
    void sweep_removesAsOfNow() {
        when(store.sweepExpired(NOW)).thenReturn(3L);
        RetentionSweepJob job = new RetentionSweepJob(store, new RetentionPolicy(30), orchestrator, clock);

        assertThat(job.sweep()).isEqualTo(3);
        verify(orchestrator, never()).halt(any());
    }

    @Test
    void corruption_haltsIngestion() {
        StorageCorruptionException corruption = new StorageCorruptionException("unreadable record");
        when(store.sweepExpired(NOW)).thenThrow(corruption);
        RetentionSweepJob job = new RetentionSweepJob(store, new RetentionPolicy(30), orchestrator, clock);

        assertThat(job.sweep()).isZero();
        verify(orchestrator).halt(corruption);
    }

    @Test
    void transientFailure_isRetriedNextCycle() {
        when(store.sweepExpired(NOW)).thenThrow(new StorageException("disk busy"));
        RetentionSweepJob job = new RetentionSweepJob(store, new RetentionPolicy(30), orchestrator, clock);

        assertThat(job.sweep()).isZero();
        verify(orchestrator, never()).halt(any());
    }
}
