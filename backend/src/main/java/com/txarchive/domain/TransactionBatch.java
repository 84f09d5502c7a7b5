package com.txarchive.domain;

import java.util.List;

/**
 * Ordered, non-empty group of notices handed to the detail fetcher as one unit.
 */
public record TransactionBatch(List<TransactionNotice> notices) {

    public TransactionBatch {
        if (notices == null || notices.isEmpty()) {
            throw new IllegalArgumentException("A batch holds at least one notice");
        }
        notices = List.copyOf(notices);
    }

    public int size() {
        return notices.size();
    }
}
