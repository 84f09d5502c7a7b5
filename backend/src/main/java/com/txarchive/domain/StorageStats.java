package com.txarchive.domain;

/**
 * Point-in-time size of the archive.
 */
public record StorageStats(long transactionCount, long sizeBytes) {
}
