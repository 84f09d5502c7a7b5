package com.txarchive.store;

import com.txarchive.domain.StorageStats;
import com.txarchive.domain.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Transaction archive in MongoDB: one document per signature in {@code transactions}, plus a schema marker
 * in {@code archive_metadata}. Replacing by {@code _id} makes upsert idempotent.
 */
@Slf4j
public class MongoTransactionStore implements TransactionStore {

    static final String METADATA_COLLECTION = "archive_metadata";
    private static final String SCHEMA_MARKER_ID = "schema";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoTransactionStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        initialize();
    }

    @Override
    public void upsert(TransactionRecord record) {
        if (record == null || record.getSignature() == null || record.getSignature().isBlank()
                || record.getFetchedAt() == null || record.getPayload() == null) {
            throw new IllegalArgumentException("signature, payload and fetchedAt required: " + record);
        }
        try {
            TransactionDocument existing = mongoTemplate.findById(record.getSignature(), TransactionDocument.class);
            if (existing != null && existing.getFetchedAt() != null
                    && existing.getFetchedAt().isAfter(record.getFetchedAt())) {
                log.debug("Keeping newer stored copy of {}", record.getSignature());
                return;
            }
            mongoTemplate.save(TransactionDocument.from(record));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to upsert " + record.getSignature(), e);
        }
    }

    @Override
    public Optional<TransactionRecord> get(String signature) {
        try {
            return Optional.ofNullable(mongoTemplate.findById(signature, TransactionDocument.class))
                    .map(TransactionDocument::toRecord)
                    .filter(r -> !r.isExpiredAt(clock.instant()));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read " + signature, e);
        }
    }

    @Override
    public long sweepExpired(Instant now) {
        try {
            Query expired = new Query(where("retentionExpiry").ne(null).lte(now));
            return mongoTemplate.remove(expired, TransactionDocument.class).getDeletedCount();
        } catch (DataAccessException e) {
            throw new StorageException("Retention sweep failed", e);
        }
    }

    @Override
    public List<TransactionRecord> findBySlotRange(long fromSlot, long toSlot) {
        if (fromSlot > toSlot) {
            return List.of();
        }
        Instant now = clock.instant();
        try {
            Query query = new Query(where("slot").gte(fromSlot).lte(toSlot))
                    .with(Sort.by(Sort.Order.asc("slot"), Sort.Order.asc("_id")));
            return mongoTemplate.find(query, TransactionDocument.class).stream()
                    .map(TransactionDocument::toRecord)
                    .filter(r -> !r.isExpiredAt(now))
                    .toList();
        } catch (DataAccessException e) {
            throw new StorageException("Slot range query failed", e);
        }
    }

    @Override
    public StorageStats stats() {
        try {
            String collection = mongoTemplate.getCollectionName(TransactionDocument.class);
            long count = mongoTemplate.count(new Query(), TransactionDocument.class);
            Document collStats = mongoTemplate.executeCommand(new Document("collStats", collection));
            Object size = collStats.get("size");
            return new StorageStats(count, size instanceof Number n ? n.longValue() : 0L);
        } catch (DataAccessException e) {
            throw new StorageException("Cannot read storage stats", e);
        }
    }

    private void initialize() {
        try {
            Document marker = mongoTemplate.findById(SCHEMA_MARKER_ID, Document.class, METADATA_COLLECTION);
            if (marker == null) {
                if (mongoTemplate.count(new Query(), TransactionDocument.class) > 0) {
                    throw new StorageCorruptionException("Transactions present without a schema marker");
                }
                mongoTemplate.save(new Document("_id", SCHEMA_MARKER_ID).append("version", SCHEMA_VERSION),
                        METADATA_COLLECTION);
                log.info("Created Mongo transaction archive (schema {})", SCHEMA_VERSION);
            } else {
                Object version = marker.get("version");
                if (!(version instanceof Number n) || n.intValue() != SCHEMA_VERSION) {
                    throw new StorageCorruptionException("Unsupported schema version " + version
                            + " (expected " + SCHEMA_VERSION + ")");
                }
                log.info("Opened Mongo transaction archive (schema {})", SCHEMA_VERSION);
            }
            IndexOperations indexOps = mongoTemplate.indexOps(TransactionDocument.class);
            indexOps.ensureIndex(new Index().on("slot", Sort.Direction.ASC).named("slot"));
            indexOps.ensureIndex(new Index().on("retentionExpiry", Sort.Direction.ASC).named("retentionExpiry"));
        } catch (DataAccessException e) {
            throw new StorageException("Cannot open Mongo storage", e);
        }
    }
}
