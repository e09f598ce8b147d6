package org.geoingest.service;

import lombok.extern.slf4j.Slf4j;
import org.geoingest.adapters.CollectorRegistry;
import org.geoingest.exception.CollectorException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.domain.RawDataRecord;
import org.geoingest.models.domain.ScheduledTask;
import org.geoingest.models.dto.RawDataQuery;
import org.geoingest.models.dto.SchedulerStats;
import org.geoingest.models.dto.StorageStats;
import org.geoingest.models.enums.SourceStatus;
import org.geoingest.service.scheduler.CollectionExecutor;
import org.geoingest.service.scheduler.CollectionOutcome;
import org.geoingest.service.scheduler.IngestionScheduler;
import org.geoingest.service.source.SourceCatalog;
import org.geoingest.service.source.SourceRegistry;
import org.geoingest.service.storage.StorageEngine;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for callers outside the ingestion core: source registration, starting and
 * stopping scheduled ingestion, manual collection and read access to stored data.
 */
@Slf4j
public class IngestionCoordinator {

    private final SourceRegistry sourceRegistry;
    private final CollectorRegistry collectorRegistry;
    private final SourceCatalog sourceCatalog;
    private final IngestionScheduler scheduler;
    private final CollectionExecutor collectionExecutor;
    private final StorageEngine storageEngine;

    public IngestionCoordinator(SourceRegistry sourceRegistry,
                                CollectorRegistry collectorRegistry,
                                SourceCatalog sourceCatalog,
                                IngestionScheduler scheduler,
                                CollectionExecutor collectionExecutor,
                                StorageEngine storageEngine) {
        this.sourceRegistry = sourceRegistry;
        this.collectorRegistry = collectorRegistry;
        this.sourceCatalog = sourceCatalog;
        this.scheduler = scheduler;
        this.collectionExecutor = collectionExecutor;
        this.storageEngine = storageEngine;
    }

    /**
     * Registers or replaces a source. While ingestion runs, an active source must have a
     * collector and is scheduled right away.
     */
    public synchronized DataSource registerSource(DataSource source) {
        if (scheduler.isRunning() && source.isActive()) {
            collectorRegistry.validateCoverage(List.of(source));
        }
        DataSource registered = sourceRegistry.register(source);
        if (scheduler.isRunning()) {
            scheduler.schedule(registered);
        }
        return registered;
    }

    public synchronized int initializeSources() {
        List<DataSource> sources = sourceCatalog.loadSources();
        sources.forEach(this::registerSource);
        log.info("Initialized {} data sources from catalog", sources.size());
        return sources.size();
    }

    /**
     * Validates that every active source has a collector, then builds the task table and starts
     * the tick loop. Does nothing if ingestion is already running.
     */
    public synchronized void startIngestion() {
        if (scheduler.isRunning()) {
            log.debug("Ingestion already running");
            return;
        }
        List<DataSource> active = sourceRegistry.listActive();
        collectorRegistry.validateCoverage(active);
        scheduler.initialize(active);
        scheduler.start();
        log.info("Ingestion started for {} active sources", active.size());
    }

    public synchronized void stopIngestion() {
        scheduler.stop();
    }

    public boolean isRunning() {
        return scheduler.isRunning();
    }

    /**
     * Collects from one source immediately, outside its schedule. Errors reach the caller.
     */
    public CollectionOutcome collectFromSource(UUID sourceId) throws CollectorException {
        sourceRegistry.require(sourceId);
        return collectionExecutor.collect(sourceId);
    }

    /**
     * Changes a source's status. While ingestion runs, activating a source whose category has
     * no collector is rejected before anything changes.
     */
    public synchronized DataSource updateSourceStatus(UUID sourceId, SourceStatus status) {
        DataSource current = sourceRegistry.require(sourceId);
        if (scheduler.isRunning() && status == SourceStatus.ACTIVE) {
            collectorRegistry.validateCoverage(List.of(current));
        }
        DataSource updated = sourceRegistry.updateStatus(sourceId, status);
        if (scheduler.isRunning()) {
            scheduler.schedule(updated);
        }
        return updated;
    }

    public synchronized ScheduledTask resumeSource(UUID sourceId) {
        DataSource source = sourceRegistry.require(sourceId);
        if (scheduler.isRunning()) {
            collectorRegistry.validateCoverage(List.of(source));
        }
        return scheduler.resume(sourceId);
    }

    public ScheduledTask forceCollection(UUID sourceId) {
        return scheduler.forceCollection(sourceId);
    }

    public boolean validateConnection(UUID sourceId) throws CollectorException {
        DataSource source = sourceRegistry.require(sourceId);
        return collectorRegistry.require(source.getCategory()).validateConnection(source);
    }

    public List<String> getAvailableParameters(UUID sourceId) throws CollectorException {
        DataSource source = sourceRegistry.require(sourceId);
        return collectorRegistry.require(source.getCategory()).getAvailableParameters(source);
    }

    public long estimateDataVolume(UUID sourceId) throws CollectorException {
        DataSource source = sourceRegistry.require(sourceId);
        return collectorRegistry.require(source.getCategory()).estimateDataVolume(source);
    }

    public DataSource getSource(UUID sourceId) {
        return sourceRegistry.require(sourceId);
    }

    public List<DataSource> listSources() {
        return sourceRegistry.listAll();
    }

    public List<ScheduledTask> listTasks() {
        return scheduler.listTasks();
    }

    public StorageStats getStorageStats() {
        return storageEngine.getStorageStats();
    }

    public SchedulerStats getSchedulerStats() {
        return scheduler.getStats();
    }

    public List<RawDataRecord> queryRawData(RawDataQuery query) {
        return storageEngine.getRawData(query);
    }

    public Optional<RawDataRecord> findRecord(UUID recordId) {
        return storageEngine.findRecord(recordId);
    }

    public int reclaimOrphans() {
        return storageEngine.reclaimOrphans();
    }
}
