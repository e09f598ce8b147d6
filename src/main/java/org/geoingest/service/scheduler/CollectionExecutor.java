package org.geoingest.service.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.geoingest.adapters.Collector;
import org.geoingest.adapters.CollectorRegistry;
import org.geoingest.exception.CollectorException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.domain.RawDataRecord;
import org.geoingest.models.entity.DataFileMetadata;
import org.geoingest.service.source.SourceRegistry;
import org.geoingest.service.storage.StorageEngine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one collect-and-store cycle for a source. Scheduled and manual collections share the
 * per-source lock, so two cycles for the same source never overlap.
 */
@Slf4j
public class CollectionExecutor {

    private final SourceRegistry sourceRegistry;
    private final CollectorRegistry collectorRegistry;
    private final StorageEngine storageEngine;
    private final Clock clock;
    private final ConcurrentMap<UUID, ReentrantLock> sourceLocks = new ConcurrentHashMap<>();

    public CollectionExecutor(SourceRegistry sourceRegistry,
                              CollectorRegistry collectorRegistry,
                              StorageEngine storageEngine,
                              Clock clock) {
        this.sourceRegistry = sourceRegistry;
        this.collectorRegistry = collectorRegistry;
        this.storageEngine = storageEngine;
        this.clock = clock;
    }

    public CollectionOutcome collect(UUID sourceId) throws CollectorException {
        ReentrantLock lock = sourceLocks.computeIfAbsent(sourceId, id -> new ReentrantLock());
        lock.lock();
        try {
            return collectLocked(sourceRegistry.require(sourceId));
        } finally {
            lock.unlock();
        }
    }

    private CollectionOutcome collectLocked(DataSource source) throws CollectorException {
        Collector collector = collectorRegistry.require(source.getCategory());
        Instant startedAt = clock.instant();

        if (!collector.validateConnection(source)) {
            throw new CollectorException(source.getProvider(), "Connection validation failed for source " + source.getName());
        }
        List<RawDataRecord> collected = collector.collectData(source);
        List<RawDataRecord> accepted = collected.stream()
                .filter(record -> source.getId().equals(record.sourceId()))
                .toList();
        int rejected = collected.size() - accepted.size();
        if (rejected > 0) {
            log.warn("Rejected {} records from {} that reference another source id", rejected, source.getName());
        }

        List<DataFileMetadata> files = storageEngine.storeBatch(accepted);
        long bytesStored = files.stream().mapToLong(DataFileMetadata::getCompressedSize).sum();
        Instant completedAt = clock.instant();
        sourceRegistry.markIngested(source.getId(), completedAt);

        log.info("Collected {} records from {} into {} files", accepted.size(), source.getName(), files.size());
        return new CollectionOutcome(source.getId(), accepted, rejected, files.size(), bytesStored,
                Duration.between(startedAt, completedAt), completedAt);
    }
}
