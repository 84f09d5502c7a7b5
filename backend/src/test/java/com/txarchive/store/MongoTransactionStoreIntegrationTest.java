package com.txarchive.store;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.txarchive.common.MutableClock;
import com.txarchive.domain.TransactionRecord;
import org.bson.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
class MongoTransactionStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private static MongoClient client;
    private MongoTemplate mongoTemplate;
    private MutableClock clock;
    private MongoTransactionStore store;

    @BeforeAll
    static void connect() {
        client = MongoClients.create(mongo.getReplicaSetUrl());
    }

    @AfterAll
    static void disconnect() {
        client.close();
    }

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(client, "txarchive_test");
        mongoTemplate.getDb().drop();
        clock = new MutableClock(NOW);
        store = new MongoTransactionStore(mongoTemplate, clock);
    }

    private static TransactionRecord record(String signature, long slot, Instant fetchedAt, Instant expiry) {
        TransactionRecord r = new TransactionRecord();
        r.setSignature(signature);
        r.setSlot(slot);
        r.setPayload("{\"slot\":1}".getBytes(StandardCharsets.UTF_8));
        r.setFetchedAt(fetchedAt.truncatedTo(ChronoUnit.MILLIS));
        r.setRetentionExpiry(expiry);
        return r;
    }

    @Test
    void upsert_sameSignatureTwice_oneDocument() {
        store.upsert(record("sig-A", 1L, NOW, NOW.plus(Duration.ofDays(30))));
        store.upsert(record("sig-A", 1L, NOW, NOW.plus(Duration.ofDays(30))));

        assertThat(mongoTemplate.count(new Query(), TransactionDocument.class))
                .isEqualTo(1);
        assertThat(store.get("sig-A")).isPresent();
        assertThat(store.stats().transactionCount()).isEqualTo(1);
    }

    @Test
    void upsert_olderFetchDoesNotReplaceNewer() {
        store.upsert(record("sig-A", 1L, NOW, null));
        store.upsert(record("sig-A", 2L, NOW.minusSeconds(5), null));

        assertThat(store.get("sig-A").orElseThrow().getSlot()).isEqualTo(1L);
    }

    @Test
    void sweep_removesOnlyExpired() {
        store.upsert(record("sig-old", 1L, NOW.minus(Duration.ofDays(31)), NOW.minus(Duration.ofDays(1))));
        store.upsert(record("sig-young", 2L, NOW.minus(Duration.ofDays(29)), NOW.plus(Duration.ofDays(1))));
        store.upsert(record("sig-forever", 3L, NOW.minus(Duration.ofDays(400)), null));

        assertThat(store.sweepExpired(NOW)).isEqualTo(1);
        assertThat(store.get("sig-old")).isEmpty();
        assertThat(store.get("sig-young")).isPresent();
        assertThat(store.get("sig-forever")).isPresent();
    }

    @Test
    void findBySlotRange_ordered() {
        store.upsert(record("sig-b", 20L, NOW, null));
        store.upsert(record("sig-a", 10L, NOW, null));

        assertThat(store.findBySlotRange(0L, 100L)).extracting(TransactionRecord::getSignature)
                .containsExactly("sig-a", "sig-b");
    }

    @Test
    void unknownSchemaVersion_isCorruption() {
        mongoTemplate.save(new Document("_id", "schema").append("version", 99), MongoTransactionStore.METADATA_COLLECTION);

        assertThatThrownBy(() -> new MongoTransactionStore(mongoTemplate, clock))
                .isInstanceOf(StorageCorruptionException.class);
    }
}
