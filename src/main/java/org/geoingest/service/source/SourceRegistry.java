package org.geoingest.service.source;

import lombok.extern.slf4j.Slf4j;
import org.geoingest.exception.SourceNotFoundException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.enums.SourceStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Authoritative in-memory set of known data sources. Reads share the lock; writes hold it
 * only long enough to swap one immutable value.
 */
@Slf4j
public class SourceRegistry {

    private static final Comparator<DataSource> BY_PRIORITY = Comparator
            .comparingInt(DataSource::getPriority).reversed()
            .thenComparing(DataSource::getName)
            .thenComparing(DataSource::getId);

    private final Map<UUID, DataSource> sources = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DataSource register(DataSource source) {
        lock.writeLock().lock();
        try {
            DataSource previous = sources.put(source.getId(), source);
            if (previous == null) {
                log.info("Registered data source {} ({}, {})", source.getName(), source.getCategory(), source.getId());
            } else {
                log.debug("Updated data source {}", source.getId());
            }
            return source;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<DataSource> get(UUID id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sources.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public DataSource require(UUID id) {
        return get(id).orElseThrow(() -> new SourceNotFoundException(id));
    }

    public boolean contains(UUID id) {
        return get(id).isPresent();
    }

    public List<DataSource> listActive() {
        lock.readLock().lock();
        try {
            return sources.values().stream()
                    .filter(DataSource::isActive)
                    .sorted(BY_PRIORITY)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DataSource> listAll() {
        lock.readLock().lock();
        try {
            return sources.values().stream().sorted(BY_PRIORITY).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long countByStatus(SourceStatus status) {
        lock.readLock().lock();
        try {
            return sources.values().stream().filter(source -> source.getStatus() == status).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    public DataSource updateStatus(UUID id, SourceStatus status) {
        DataSource updated = replace(id, source -> source.toBuilder().status(status).build());
        log.info("Data source {} status set to {}", updated.getName(), status);
        return updated;
    }

    public DataSource markIngested(UUID id, Instant ingestedAt) {
        return replace(id, source -> source.toBuilder().lastIngestion(ingestedAt).build());
    }

    private DataSource replace(UUID id, UnaryOperator<DataSource> change) {
        lock.writeLock().lock();
        try {
            DataSource current = sources.get(id);
            if (current == null) {
                throw new SourceNotFoundException(id);
            }
            DataSource updated = change.apply(current);
            sources.put(id, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
