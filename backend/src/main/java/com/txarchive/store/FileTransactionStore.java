package com.txarchive.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.txarchive.domain.StorageStats;
import com.txarchive.domain.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Transaction archive on the local filesystem.
 * <p>
 * Layout under the storage root: a {@code schema-version} marker and one JSON file per signature at
 * {@code transactions/<first two chars>/<signature>.json}. Every file is written to a temp sibling, forced
 * to disk and atomically renamed, so a crash leaves either the old or the new record, never a torn one.
 * Writers of the same signature serialize on a lock stripe; readers never lock.
 */
@Slf4j
public class FileTransactionStore implements TransactionStore {

    static final String SCHEMA_FILE = "schema-version";
    static final String RECORDS_DIR = "transactions";
    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final Pattern SIGNATURE = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final int LOCK_STRIPES = 64;

    private final Path root;
    private final Path recordsDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public FileTransactionStore(Path root, ObjectMapper objectMapper, Clock clock) {
        this.root = root;
        this.recordsDir = root.resolve(RECORDS_DIR);
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
        initialize();
    }

    @Override
    public void upsert(TransactionRecord record) {
        validate(record);
        String signature = record.getSignature();
        Path target = pathFor(signature);
        synchronized (lockFor(signature)) {
            StoredRecord existing = read(target);
            if (existing != null && parseInstant(existing.fetchedAt(), target).isAfter(record.getFetchedAt())) {
                log.debug("Keeping newer stored copy of {}", signature);
                return;
            }
            try {
                Files.createDirectories(target.getParent());
                writeAtomically(target, objectMapper.writeValueAsBytes(StoredRecord.from(record)));
            } catch (IOException e) {
                throw new StorageException("Failed to write " + signature + " to " + target, e);
            }
        }
    }

    @Override
    public Optional<TransactionRecord> get(String signature) {
        requireValidSignature(signature);
        Path file = pathFor(signature);
        StoredRecord stored = read(file);
        if (stored == null) {
            return Optional.empty();
        }
        TransactionRecord record = stored.toRecord(file);
        return record.isExpiredAt(clock.instant()) ? Optional.empty() : Optional.of(record);
    }

    @Override
    public long sweepExpired(Instant now) {
        long removed = 0;
        for (Path file : listRecordFiles()) {
            String signature = signatureOf(file);
            synchronized (lockFor(signature)) {
                StoredRecord stored = read(file);
                if (stored == null || stored.retentionExpiry() == null) {
                    continue;
                }
                if (!parseInstant(stored.retentionExpiry(), file).isAfter(now)) {
                    try {
                        Files.deleteIfExists(file);
                        removed++;
                    } catch (IOException e) {
                        throw new StorageException("Failed to delete expired " + file, e);
                    }
                }
            }
        }
        return removed;
    }

    @Override
    public List<TransactionRecord> findBySlotRange(long fromSlot, long toSlot) {
        if (fromSlot > toSlot) {
            return List.of();
        }
        Instant now = clock.instant();
        List<TransactionRecord> out = new ArrayList<>();
        for (Path file : listRecordFiles()) {
            StoredRecord stored = read(file);
            if (stored == null || stored.slot() < fromSlot || stored.slot() > toSlot) {
                continue;
            }
            TransactionRecord record = stored.toRecord(file);
            if (!record.isExpiredAt(now)) {
                out.add(record);
            }
        }
        out.sort(Comparator.comparingLong(TransactionRecord::getSlot).thenComparing(TransactionRecord::getSignature));
        return out;
    }

    @Override
    public StorageStats stats() {
        long count = 0;
        long bytes = 0;
        for (Path file : listRecordFiles()) {
            try {
                bytes += Files.size(file);
                count++;
            } catch (NoSuchFileException e) {
                // swept concurrently
            } catch (IOException e) {
                throw new StorageException("Cannot stat " + file, e);
            }
        }
        return new StorageStats(count, bytes);
    }

    Path pathFor(String signature) {
        String shard = signature.length() >= 2 ? signature.substring(0, 2) : signature;
        return recordsDir.resolve(shard).resolve(signature + RECORD_SUFFIX);
    }

    private void initialize() {
        Path marker = root.resolve(SCHEMA_FILE);
        try {
            Files.createDirectories(recordsDir);
            removeLeftoverTempFiles();
            if (Files.exists(marker)) {
                String content = Files.readString(marker, StandardCharsets.UTF_8).trim();
                int version;
                try {
                    version = Integer.parseInt(content);
                } catch (NumberFormatException e) {
                    throw new StorageCorruptionException("Unreadable schema marker " + marker + ": '" + content + "'", e);
                }
                if (version != SCHEMA_VERSION) {
                    throw new StorageCorruptionException("Unsupported schema version " + version + " at " + root
                            + " (expected " + SCHEMA_VERSION + ")");
                }
                log.info("Opened transaction archive at {} (schema {})", root, version);
            } else {
                if (!listRecordFiles().isEmpty()) {
                    throw new StorageCorruptionException("Records present at " + root + " without a schema marker");
                }
                writeAtomically(marker, (SCHEMA_VERSION + "\n").getBytes(StandardCharsets.UTF_8));
                log.info("Created transaction archive at {} (schema {})", root, SCHEMA_VERSION);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot open storage at " + root, e);
        }
    }

    private void removeLeftoverTempFiles() throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            for (Path tmp : files.filter(p -> p.getFileName().toString().endsWith(TEMP_SUFFIX)).toList()) {
                Files.deleteIfExists(tmp);
                log.debug("Removed interrupted write {}", tmp);
            }
        }
    }

    /**
     * Record files currently under the records directory. Entries removed while the walk runs (temp files
     * renamed into place, records swept) are skipped.
     */
    private List<Path> listRecordFiles() {
        List<Path> out = new ArrayList<>();
        try {
            Files.walkFileTree(recordsDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().endsWith(RECORD_SUFFIX)) {
                        out.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
                    if (e instanceof NoSuchFileException) {
                        return FileVisitResult.CONTINUE;
                    }
                    throw e;
                }
            });
        } catch (IOException e) {
            throw new StorageException("Cannot list records under " + recordsDir, e);
        }
        return out;
    }

    private StoredRecord read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new StorageException("Cannot read " + file, e);
        }
        StoredRecord stored;
        try {
            stored = objectMapper.readValue(bytes, StoredRecord.class);
        } catch (IOException e) {
            throw new StorageCorruptionException("Unreadable record " + file, e);
        }
        if (stored.schemaVersion() != SCHEMA_VERSION || stored.signature() == null || stored.fetchedAt() == null
                || !file.getFileName().toString().equals(stored.signature() + RECORD_SUFFIX)) {
            throw new StorageCorruptionException("Inconsistent record " + file);
        }
        return stored;
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TEMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Object lockFor(String signature) {
        return locks[Math.floorMod(signature.hashCode(), LOCK_STRIPES)];
    }

    private static String signatureOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - RECORD_SUFFIX.length());
    }

    private static void validate(TransactionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record required");
        }
        requireValidSignature(record.getSignature());
        if (record.getPayload() == null) {
            throw new IllegalArgumentException("payload required for " + record.getSignature());
        }
        if (record.getFetchedAt() == null) {
            throw new IllegalArgumentException("fetchedAt required for " + record.getSignature());
        }
    }

    private static void requireValidSignature(String signature) {
        if (signature == null || !SIGNATURE.matcher(signature).matches()) {
            throw new IllegalArgumentException("Invalid signature: " + signature);
        }
    }

    private static Instant parseInstant(String value, Path file) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new StorageCorruptionException("Bad timestamp '" + value + "' in " + file, e);
        }
    }

    /** On-disk shape of one record. Instants as ISO-8601 text, payload base64. */
    record StoredRecord(
            int schemaVersion,
            String signature,
            long slot,
            Long blockTime,
            byte[] payload,
            String fetchedAt,
            String retentionExpiry
    ) {

        static StoredRecord from(TransactionRecord record) {
            return new StoredRecord(SCHEMA_VERSION, record.getSignature(), record.getSlot(), record.getBlockTime(),
                    record.getPayload(), record.getFetchedAt().toString(),
                    record.getRetentionExpiry() != null ? record.getRetentionExpiry().toString() : null);
        }

        TransactionRecord toRecord(Path file) {
            TransactionRecord record = new TransactionRecord();
            record.setSignature(signature);
            record.setSlot(slot);
            record.setBlockTime(blockTime);
            record.setPayload(payload);
            record.setFetchedAt(parseInstant(fetchedAt, file));
            record.setRetentionExpiry(retentionExpiry != null ? parseInstant(retentionExpiry, file) : null);
            return record;
        }
    }
}
