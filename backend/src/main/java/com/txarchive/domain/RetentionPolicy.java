package com.txarchive.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Retention window in days. Zero means records are kept forever and never swept.
 */
public record RetentionPolicy(long retentionDays) {

    public RetentionPolicy {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0");
        }
    }

    public boolean isUnbounded() {
        return retentionDays == 0;
    }

    public Optional<Instant> expiryFor(Instant fetchedAt) {
        if (isUnbounded()) {
            return Optional.empty();
        }
        return Optional.of(fetchedAt.plus(Duration.ofDays(retentionDays)));
    }
}
