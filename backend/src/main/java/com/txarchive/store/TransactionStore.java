package com.txarchive.store;

import com.txarchive.domain.StorageStats;
import com.txarchive.domain.TransactionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, signature-keyed archive of transaction records. At most one record per signature.
 * <p>
 * Implementations accept concurrent callers. {@link StorageException} is recoverable,
 * {@link StorageCorruptionException} is not.
 */
public interface TransactionStore {

    int SCHEMA_VERSION = 1;

    /**
     * Insert or replace the record for its signature. A stored copy with a later fetchedAt is kept.
     */
    void upsert(TransactionRecord record);

    /**
     * The stored record, or empty when absent or already past its retention expiry.
     */
    Optional<TransactionRecord> get(String signature);

    /**
     * Delete every record whose retention expiry is at or before {@code now}.
     *
     * @return number of records removed
     */
    long sweepExpired(Instant now);

    /**
     * Unexpired records with {@code fromSlot <= slot <= toSlot}, ordered by slot then signature.
     */
    List<TransactionRecord> findBySlotRange(long fromSlot, long toSlot);

    StorageStats stats();
}
