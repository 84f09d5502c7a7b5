package com.txarchive.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txarchive.common.MutableClock;
import com.txarchive.domain.RetentionPolicy;
import com.txarchive.domain.TransactionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileTransactionStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
    private static final RetentionPolicy THIRTY_DAYS = new RetentionPolicy(30);

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private FileTransactionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new FileTransactionStore(root, objectMapper, clock);
    }

    private static TransactionRecord record(String signature, long slot, Instant fetchedAt, String payload) {
        TransactionRecord r = new TransactionRecord();
        r.setSignature(signature);
        r.setSlot(slot);
        r.setBlockTime(1714521600L);
        r.setPayload(payload.getBytes(StandardCharsets.UTF_8));
        r.setFetchedAt(fetchedAt);
        r.setRetentionExpiry(THIRTY_DAYS.expiryFor(fetchedAt).orElse(null));
        return r;
    }

    private long filesOnDisk() throws Exception {
        try (Stream<Path> files = Files.walk(root.resolve(FileTransactionStore.RECORDS_DIR))) {
            return files.filter(Files::isRegularFile).count();
        }
    }

    @Test
    void upsertThenGet_roundTripsAllFields() {
        TransactionRecord record = record("sig-A", 42L, NOW, "{\"slot\":42}");
        store.upsert(record);

        assertThat(store.get("sig-A")).contains(record);
        assertThat(store.get("sig-missing")).isEmpty();
    }

    @Test
    @DisplayName("upserting the same signature twice leaves exactly one record")
    void upsert_isIdempotentAndUnique() throws Exception {
        store.upsert(record("sig-A", 1L, NOW, "{\"v\":1}"));
        store.upsert(record("sig-A", 1L, NOW, "{\"v\":1}"));

        assertThat(filesOnDisk()).isEqualTo(1);
        assertThat(store.stats().transactionCount()).isEqualTo(1);
    }

    @Test
    void upsert_lastWriteByFetchedAtWins() {
        store.upsert(record("sig-A", 1L, NOW, "{\"v\":\"new\"}"));
        store.upsert(record("sig-A", 1L, NOW.minusSeconds(60), "{\"v\":\"old\"}"));

        assertThat(new String(store.get("sig-A").orElseThrow().getPayload(), StandardCharsets.UTF_8)).contains("new");

        store.upsert(record("sig-A", 1L, NOW.plusSeconds(60), "{\"v\":\"newer\"}"));
        assertThat(new String(store.get("sig-A").orElseThrow().getPayload(), StandardCharsets.UTF_8)).contains("newer");
    }

    @Test
    @DisplayName("sweep removes records fetched d+1 days ago and keeps those fetched d-1 days ago")
    void sweep_respectsRetentionBoundary() {
        store.upsert(record("sig-old", 1L, NOW.minus(Duration.ofDays(31)), "{}"));
        store.upsert(record("sig-young", 2L, NOW.minus(Duration.ofDays(29)), "{}"));

        long removed = store.sweepExpired(NOW);

        assertThat(removed).isEqualTo(1);
        assertThat(store.get("sig-old")).isEmpty();
        assertThat(store.get("sig-young")).isPresent();
    }

    @Test
    void sweep_keepsRecordsWithoutExpiry() {
        TransactionRecord forever = record("sig-forever", 1L, NOW.minus(Duration.ofDays(400)), "{}");
        forever.setRetentionExpiry(null);
        store.upsert(forever);

        assertThat(store.sweepExpired(NOW)).isZero();
        assertThat(store.get("sig-forever")).isPresent();
    }

    @Test
    void get_hidesExpiredRecordBeforeSweep() {
        store.upsert(record("sig-A", 1L, NOW.minus(Duration.ofDays(31)), "{}"));

        assertThat(store.get("sig-A")).isEmpty();
        assertThat(store.stats().transactionCount()).isEqualTo(1);
    }

    @Test
    void records_surviveReopen() {
        store.upsert(record("sig-A", 7L, NOW, "{\"x\":1}"));

        FileTransactionStore reopened = new FileTransactionStore(root, objectMapper, clock);

        assertThat(reopened.get("sig-A")).isPresent();
        assertThat(Files.exists(root.resolve(FileTransactionStore.SCHEMA_FILE))).isTrue();
    }

    @Test
    void reopen_removesInterruptedWrites() throws Exception {
        Path shard = Files.createDirectories(root.resolve(FileTransactionStore.RECORDS_DIR).resolve("si"));
        Path leftover = Files.writeString(shard.resolve("sig-X.json123.tmp"), "{\"half");

        new FileTransactionStore(root, objectMapper, clock);

        assertThat(Files.exists(leftover)).isFalse();
    }

    @Test
    void unknownSchemaVersion_isCorruption() throws Exception {
        Files.writeString(root.resolve(FileTransactionStore.SCHEMA_FILE), "99\n");

        assertThatThrownBy(() -> new FileTransactionStore(root, objectMapper, clock))
                .isInstanceOf(StorageCorruptionException.class)
                .hasMessageContaining("99");
    }

    @Test
    void unreadableRecord_isCorruption() throws Exception {
        store.upsert(record("sig-A", 1L, NOW, "{}"));
        Files.writeString(store.pathFor("sig-A"), "not json");

        assertThatThrownBy(() -> store.get("sig-A")).isInstanceOf(StorageCorruptionException.class);
        assertThatThrownBy(() -> store.sweepExpired(NOW)).isInstanceOf(StorageCorruptionException.class);
    }

    @Test
    void findBySlotRange_ordersBySlotAndSkipsExpired() {
        store.upsert(record("sig-c", 30L, NOW, "{}"));
        store.upsert(record("sig-a", 10L, NOW, "{}"));
        store.upsert(record("sig-b", 20L, NOW.minus(Duration.ofDays(31)), "{}"));
        store.upsert(record("sig-d", 40L, NOW, "{}"));

        List<TransactionRecord> found = store.findBySlotRange(10L, 30L);

        assertThat(found).extracting(TransactionRecord::getSignature).containsExactly("sig-a", "sig-c");
        assertThat(store.findBySlotRange(50L, 10L)).isEmpty();
    }

    @Test
    void invalidSignature_rejected() {
        assertThatThrownBy(() -> store.upsert(record("../escape", 1L, NOW, "{}")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.get("a/b")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("sweep, stats and range reads keep working while new records are being written")
    void sweep_whileWriterUpserts_neverFailsTheCycle() throws Exception {
        Instant longAgo = NOW.minus(Duration.ofDays(40));
        for (int i = 0; i < 50; i++) {
            store.upsert(record("old" + i, i, longAgo, "{}"));
        }
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger written = new AtomicInteger();
        ExecutorService writer = Executors.newSingleThreadExecutor();
        Future<?> writes = writer.submit(() -> {
            while (writing.get()) {
                int n = written.getAndIncrement();
                store.upsert(record("new" + n, 1_000L + n, NOW, "{\"n\":" + n + "}"));
            }
        });

        long removed = 0;
        long deadline = System.currentTimeMillis() + 1_500;
        try {
            while (System.currentTimeMillis() < deadline) {
                removed += store.sweepExpired(NOW);
                assertThat(store.stats().transactionCount()).isPositive();
                store.findBySlotRange(0L, 2_000L);
            }
        } finally {
            writing.set(false);
            writes.get();
            writer.shutdown();
        }

        assertThat(removed).isEqualTo(50);
        assertThat(written.get()).isPositive();
        assertThat(store.stats().transactionCount()).isEqualTo(written.get());
    }

    @Test
    void concurrentUpserts_sameSignature_leaveOneRecord() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                Instant fetchedAt = NOW.plusSeconds(i);
                futures.add(executor.submit(() -> store.upsert(record("sig-A", 1L, fetchedAt, "{\"at\":\"" + fetchedAt + "\"}"))));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(filesOnDisk()).isEqualTo(1);
        assertThat(store.get("sig-A").orElseThrow().getFetchedAt()).isEqualTo(NOW.plusSeconds(39));
    }
}
