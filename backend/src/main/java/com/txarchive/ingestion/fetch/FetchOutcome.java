package com.txarchive.ingestion.fetch;

import com.txarchive.domain.TransactionRecord;

/**
 * Result of resolving one signature.
 */
public record FetchOutcome(
        String signature,
        Status status,
        TransactionRecord record,
        int attempts,
        Throwable error
) {

    public enum Status {
        FETCHED,
        /** The chain never had, or has pruned, this signature. Terminal. */
        NOT_FOUND,
        /** Every attempt failed, or the endpoint refused the request itself. */
        FAILED
    }

    public static FetchOutcome fetched(TransactionRecord record, int attempts) {
        return new FetchOutcome(record.getSignature(), Status.FETCHED, record, attempts, null);
    }

    public static FetchOutcome notFound(String signature, int attempts) {
        return new FetchOutcome(signature, Status.NOT_FOUND, null, attempts, null);
    }

    public static FetchOutcome failed(String signature, int attempts, Throwable error) {
        return new FetchOutcome(signature, Status.FAILED, null, attempts, error);
    }

    public boolean isFetched() {
        return status == Status.FETCHED;
    }
}
