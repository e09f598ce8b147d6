package org.geoingest.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.geoingest.exception.StorageException;
import org.geoingest.models.domain.RawDataRecord;
import org.geoingest.models.dto.RawDataQuery;
import org.geoingest.models.dto.StorageStats;
import org.geoingest.models.entity.DataFileMetadata;
import org.geoingest.models.entity.DataRecordIndex;
import org.geoingest.repository.DataFileMetadataRepository;
import org.geoingest.repository.DataFileMetadataRepository.StorageTotals;
import org.geoingest.repository.DataRecordIndexRepository;
import org.geoingest.service.storage.BatchPartitioner.BatchKey;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.transaction.support.TransactionOperations;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import static org.geoingest.repository.DataFileMetadataSpecifications.endsAtOrAfter;
import static org.geoingest.repository.DataFileMetadataSpecifications.forSource;
import static org.geoingest.repository.DataFileMetadataSpecifications.hasAnyParameter;
import static org.geoingest.repository.DataFileMetadataSpecifications.startsAtOrBefore;

/**
 * Append-only record storage. Records are written as compressed blobs under
 * {@code raw/yyyy/MM/dd/HH/{file-id}.blob}; file metadata and a per-record index are
 * committed only after every blob of a call is on disk.
 */
@Slf4j
public class StorageEngine {

    static final String RAW_DIRECTORY = "raw";
    static final String TEMP_DIRECTORY = "temp";
    static final String BLOB_EXTENSION = ".blob";

    private static final DateTimeFormatter HOUR_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd/HH").withZone(ZoneOffset.UTC);
    private static final Sort FILE_ORDER = Sort.by("timeRangeStart", "createdAt");

    private final Path basePath;
    private final Path tempDirectory;
    private final BlobCodec codec;
    private final DataFileMetadataRepository fileMetadataRepository;
    private final DataRecordIndexRepository recordIndexRepository;
    private final TransactionOperations transactions;
    private final Clock clock;
    private final int defaultQueryLimit;
    private final Duration orphanGracePeriod;

    public StorageEngine(Path basePath,
                         BlobCodec codec,
                         DataFileMetadataRepository fileMetadataRepository,
                         DataRecordIndexRepository recordIndexRepository,
                         TransactionOperations transactions,
                         Clock clock,
                         int defaultQueryLimit,
                         Duration orphanGracePeriod) {
        if (defaultQueryLimit <= 0) {
            throw new IllegalArgumentException("Default query limit must be positive, got " + defaultQueryLimit);
        }
        this.basePath = basePath.toAbsolutePath().normalize();
        this.tempDirectory = this.basePath.resolve(TEMP_DIRECTORY);
        this.codec = codec;
        this.fileMetadataRepository = fileMetadataRepository;
        this.recordIndexRepository = recordIndexRepository;
        this.transactions = transactions;
        this.clock = clock;
        this.defaultQueryLimit = defaultQueryLimit;
        this.orphanGracePeriod = orphanGracePeriod;
        try {
            Files.createDirectories(this.basePath.resolve(RAW_DIRECTORY));
            Files.createDirectories(tempDirectory);
        } catch (IOException e) {
            throw new StorageException("Failed to create storage directories under " + this.basePath, e);
        }
    }

    /**
     * Writes the records as one blob per source and hour. Either every blob and all of their
     * metadata are stored, or nothing is committed and a {@link StorageException} is thrown.
     */
    public List<DataFileMetadata> storeBatch(Collection<RawDataRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        List<Path> written = new ArrayList<>();
        List<DataFileMetadata> files = new ArrayList<>();
        Map<UUID, DataRecordIndex> index = new LinkedHashMap<>();
        try {
            for (Map.Entry<BatchKey, List<RawDataRecord>> batch : BatchPartitioner.partition(records).entrySet()) {
                DataFileMetadata file = writeBlob(batch.getKey(), batch.getValue(), written);
                files.add(file);
                for (RawDataRecord record : batch.getValue()) {
                    index.putIfAbsent(record.id(), indexEntry(record, file));
                }
            }
            transactions.executeWithoutResult(status -> persistMetadata(files, index));
        } catch (IOException | RuntimeException e) {
            discard(written);
            throw new StorageException("Failed to store batch of " + records.size() + " records: " + e.getMessage(), e);
        }
        log.debug("Stored {} records in {} files", records.size(), files.size());
        return files;
    }

    private DataFileMetadata writeBlob(BatchKey key, List<RawDataRecord> batch, List<Path> written) throws IOException {
        UUID fileId = UUID.randomUUID();
        String relativePath = RAW_DIRECTORY + "/" + HOUR_PATH.format(key.hour()) + "/" + fileId + BLOB_EXTENSION;
        Path target = basePath.resolve(relativePath);
        BlobCodec.EncodedBlob blob = codec.encode(batch);

        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(tempDirectory, fileId.toString(), ".tmp");
        try {
            Files.write(temp, blob.compressed());
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
        written.add(target);

        Set<String> parameters = new LinkedHashSet<>();
        batch.forEach(record -> parameters.addAll(record.metadata().parameters().keySet()));
        return DataFileMetadata.builder()
                .fileId(fileId)
                .sourceId(key.sourceId())
                .filePath(relativePath)
                .fileSize(blob.uncompressedSize())
                .compressedSize(blob.compressed().length)
                .recordCount(batch.size())
                .checksum(blob.checksum())
                .createdAt(clock.instant())
                .timeRangeStart(floorMicros(batch.get(0).timestamp()))
                .timeRangeEnd(ceilMicros(batch.get(batch.size() - 1).timestamp()))
                .parameters(parameters)
                .build();
    }

    // The database keeps microseconds; widening the range keeps the file filter from cutting off
    // records with nanosecond timestamps.
    static Instant floorMicros(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    static Instant ceilMicros(Instant instant) {
        Instant floor = instant.truncatedTo(ChronoUnit.MICROS);
        return floor.equals(instant) ? floor : floor.plus(1, ChronoUnit.MICROS);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target);
        }
    }

    private static DataRecordIndex indexEntry(RawDataRecord record, DataFileMetadata file) {
        return DataRecordIndex.builder()
                .recordId(record.id())
                .sourceId(record.sourceId())
                .timestamp(record.timestamp())
                .fileId(file.getFileId())
                .filePath(file.getFilePath())
                .parameters(List.copyOf(record.metadata().parameters().keySet()))
                .build();
    }

    private void persistMetadata(List<DataFileMetadata> files, Map<UUID, DataRecordIndex> index) {
        fileMetadataRepository.saveAll(files);
        // A record collected twice keeps pointing at the file it was first stored in.
        Set<UUID> known = new HashSet<>();
        recordIndexRepository.findAllById(index.keySet()).forEach(entry -> known.add(entry.getRecordId()));
        List<DataRecordIndex> fresh = index.values().stream()
                .filter(entry -> !known.contains(entry.getRecordId()))
                .toList();
        recordIndexRepository.saveAll(fresh);
    }

    private void discard(List<Path> written) {
        for (Path path : written) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Could not remove blob {} after failed write, it will be reclaimed as an orphan: {}", path, e.getMessage());
            }
        }
    }

    /**
     * Returns stored records matching every filter of the query, reading candidate files in
     * time order until the limit is reached. Unreadable files and malformed records are skipped.
     */
    public List<RawDataRecord> getRawData(RawDataQuery query) {
        int limit = query.effectiveLimit(defaultQueryLimit);
        Specification<DataFileMetadata> candidates = Specification.allOf(
                forSource(query.sourceId()),
                endsAtOrAfter(query.timeStart()),
                startsAtOrBefore(query.timeEnd()),
                hasAnyParameter(query.parameters()));

        List<RawDataRecord> results = new ArrayList<>();
        for (DataFileMetadata file : fileMetadataRepository.findAll(candidates, FILE_ORDER)) {
            for (RawDataRecord record : readFile(file)) {
                if (query.matches(record)) {
                    results.add(record);
                    if (results.size() >= limit) {
                        return results;
                    }
                }
            }
        }
        return results;
    }

    public Optional<RawDataRecord> findRecord(UUID recordId) {
        return recordIndexRepository.findById(recordId)
                .flatMap(entry -> fileMetadataRepository.findById(entry.getFileId()))
                .flatMap(file -> readFile(file).stream()
                        .filter(record -> record.id().equals(recordId))
                        .findFirst());
    }

    public boolean verifyFile(UUID fileId) {
        DataFileMetadata file = fileMetadataRepository.findById(fileId)
                .orElseThrow(() -> new StorageException("Unknown data file " + fileId));
        try {
            return codec.verify(Files.readAllBytes(resolve(file)), file.getChecksum());
        } catch (IOException e) {
            log.warn("Data file {} could not be read for verification: {}", fileId, e.getMessage());
            return false;
        }
    }

    private List<RawDataRecord> readFile(DataFileMetadata file) {
        Path path = resolve(file);
        try {
            byte[] compressed = Files.readAllBytes(path);
            if (!codec.verify(compressed, file.getChecksum())) {
                log.warn("Checksum mismatch for data file {} at {}, skipping", file.getFileId(), path);
                return List.of();
            }
            BlobCodec.DecodedBlob decoded = codec.decode(compressed);
            if (decoded.skipped() > 0) {
                log.warn("Skipped {} malformed records in data file {}", decoded.skipped(), file.getFileId());
            }
            return decoded.records();
        } catch (NoSuchFileException e) {
            log.warn("Data file {} is missing at {}, skipping", file.getFileId(), path);
            return List.of();
        } catch (IOException e) {
            log.warn("Data file {} could not be decoded, skipping: {}", file.getFileId(), e.getMessage());
            return List.of();
        }
    }

    private Path resolve(DataFileMetadata file) {
        return basePath.resolve(file.getFilePath());
    }

    public StorageStats getStorageStats() {
        StorageTotals totals = fileMetadataRepository.aggregateTotals();
        double ratio = totals.getTotalSize() > 0
                ? (double) totals.getCompressedSize() / totals.getTotalSize()
                : 0.0;
        return new StorageStats(
                totals.getTotalRecords(),
                totals.getFileCount(),
                totals.getTotalSize(),
                totals.getCompressedSize(),
                ratio,
                totals.getOldestRecord(),
                totals.getNewestRecord(),
                totals.getSourceCount());
    }

    /**
     * Blobs under {@code raw/} with no metadata row, left behind by a crash between the blob
     * write and the metadata commit. Files younger than the grace period are ignored since
     * their write may still be in progress.
     */
    public List<Path> findOrphanBlobs() {
        Set<String> known = new HashSet<>(fileMetadataRepository.findAllFilePaths());
        Instant cutoff = clock.instant().minus(orphanGracePeriod);
        try (Stream<Path> files = Files.walk(basePath.resolve(RAW_DIRECTORY))) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(BLOB_EXTENSION))
                    .filter(path -> !known.contains(relativize(path)))
                    .filter(path -> modifiedBefore(path, cutoff))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Failed to scan for orphan blobs", e);
        }
    }

    public int reclaimOrphans() {
        int removed = 0;
        for (Path orphan : findOrphanBlobs()) {
            try {
                if (Files.deleteIfExists(orphan)) {
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Failed to delete orphan blob {}: {}", orphan, e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("Reclaimed {} orphan blobs", removed);
        }
        return removed;
    }

    private String relativize(Path path) {
        return basePath.relativize(path).toString().replace(File.separatorChar, '/');
    }

    private static boolean modifiedBefore(Path path, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            throw new StorageException("Failed to read modification time of " + path, e);
        }
    }
}
