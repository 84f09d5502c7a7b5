package com.txarchive.store;

import com.txarchive.domain.TransactionRecord;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo shape of an archived transaction, keyed by signature.
 */
@Document(collection = "transactions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransactionDocument {

    @Id
    @EqualsAndHashCode.Include
    private String signature;
    private long slot;
    private Long blockTime;
    /** Raw getTransaction result JSON, UTF-8 bytes. */
    private byte[] payload;
    private Instant fetchedAt;
    /** Null when retention is unbounded. */
    private Instant retentionExpiry;

    static TransactionDocument from(TransactionRecord record) {
        TransactionDocument doc = new TransactionDocument();
        doc.setSignature(record.getSignature());
        doc.setSlot(record.getSlot());
        doc.setBlockTime(record.getBlockTime());
        doc.setPayload(record.getPayload());
        doc.setFetchedAt(record.getFetchedAt());
        doc.setRetentionExpiry(record.getRetentionExpiry());
        return doc;
    }

    TransactionRecord toRecord() {
        TransactionRecord record = new TransactionRecord();
        record.setSignature(signature);
        record.setSlot(slot);
        record.setBlockTime(blockTime);
        record.setPayload(payload);
        record.setFetchedAt(fetchedAt);
        record.setRetentionExpiry(retentionExpiry);
        return record;
    }
}
