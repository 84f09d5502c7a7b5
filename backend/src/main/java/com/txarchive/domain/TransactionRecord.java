package com.txarchive.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Archived transaction: the full getTransaction result for one signature.
 * One record per signature; re-delivery replaces the stored value (last write by fetchedAt wins).
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
@ToString(exclude = "payload")
public class TransactionRecord {

    private String signature;
    private long slot;
    /** Unix seconds as reported by the chain; null when the node did not report one. */
    private Long blockTime;
    /** Raw JSON of the RPC result, UTF-8. */
    private byte[] payload;
    private Instant fetchedAt;
    /** fetchedAt + retention window; null when retention is unbounded. */
    private Instant retentionExpiry;

    public boolean isExpiredAt(Instant now) {
        return retentionExpiry != null && !retentionExpiry.isAfter(now);
    }
}
