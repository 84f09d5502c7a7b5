package com.txarchive.query;

import com.txarchive.domain.StorageStats;
import com.txarchive.domain.TransactionRecord;
import com.txarchive.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the archive for the external status API.
 */
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    /** Upper bound on a single slot-range read. */
    static final long MAX_SLOT_SPAN = 10_000L;

    private final TransactionStore transactionStore;

    public Optional<TransactionRecord> find(String signature) {
        if (signature == null || signature.isBlank()) {
            return Optional.empty();
        }
        return transactionStore.get(signature.trim());
    }

    public List<TransactionRecord> findBySlotRange(long fromSlot, long toSlot) {
        if (fromSlot < 0 || toSlot < fromSlot) {
            throw new IllegalArgumentException("Invalid slot range [" + fromSlot + ", " + toSlot + "]");
        }
        if (toSlot - fromSlot > MAX_SLOT_SPAN) {
            throw new IllegalArgumentException("Slot range wider than " + MAX_SLOT_SPAN);
        }
        return transactionStore.findBySlotRange(fromSlot, toSlot);
    }

    public StorageStats stats() {
        return transactionStore.stats();
    }
}
