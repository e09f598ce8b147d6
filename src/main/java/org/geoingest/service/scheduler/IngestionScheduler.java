package org.geoingest.service.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.geoingest.exception.CollectorException;
import org.geoingest.exception.SourceNotFoundException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.domain.ScheduledTask;
import org.geoingest.models.dto.SchedulerStats;
import org.geoingest.models.enums.SourceStatus;
import org.geoingest.models.enums.TaskStatus;
import org.geoingest.service.source.SourceRegistry;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns one {@link ScheduledTask} per active source and, on every tick, dispatches the due ones
 * to a bounded worker pool. A tick never waits for the work it dispatched; a task stays
 * {@link TaskStatus#RUNNING} until its execution reports back, which keeps it out of later ticks.
 */
@Slf4j
public class IngestionScheduler {

    private static final Comparator<ScheduledTask> DISPATCH_ORDER = Comparator
            .comparingInt(ScheduledTask::getPriority).reversed()
            .thenComparing(ScheduledTask::getNextExecution);

    private final SourceRegistry sourceRegistry;
    private final CollectionExecutor collectionExecutor;
    private final RetryPolicy retryPolicy;
    private final Executor workers;
    private final TaskScheduler tickScheduler;
    private final Clock clock;
    private final Duration tickInterval;

    private final Map<UUID, ScheduledTask> tasks = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicLong totalExecutions = new AtomicLong();
    private final AtomicLong successfulExecutions = new AtomicLong();
    private final AtomicLong failedExecutions = new AtomicLong();
    private final AtomicLong recordsProcessed = new AtomicLong();
    private final AtomicLong bytesCollected = new AtomicLong();
    private final AtomicLong executionMillis = new AtomicLong();
    private volatile Instant lastCollectionTime;
    private volatile Instant startedAt;
    private volatile ScheduledFuture<?> tickLoop;

    public IngestionScheduler(SourceRegistry sourceRegistry,
                              CollectionExecutor collectionExecutor,
                              RetryPolicy retryPolicy,
                              Executor workers,
                              TaskScheduler tickScheduler,
                              Clock clock,
                              Duration tickInterval) {
        this.sourceRegistry = sourceRegistry;
        this.collectionExecutor = collectionExecutor;
        this.retryPolicy = retryPolicy;
        this.workers = workers;
        this.tickScheduler = tickScheduler;
        this.clock = clock;
        this.tickInterval = tickInterval;
    }

    /**
     * Replaces the task table with one task per given source, each first due one frequency
     * offset from now.
     */
    public void initialize(Collection<DataSource> activeSources) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            tasks.clear();
            for (DataSource source : activeSources) {
                if (source.isActive()) {
                    tasks.put(source.getId(), newTask(source, now.plus(source.getUpdateFrequency().offset())));
                }
            }
            log.info("Scheduler initialized with {} tasks", tasks.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Adds a task for a newly active source, or refreshes frequency and priority of an existing
     * one without moving its next execution. Inactive sources are unscheduled.
     */
    public Optional<ScheduledTask> schedule(DataSource source) {
        if (!source.isActive()) {
            unschedule(source.getId());
            return Optional.empty();
        }
        lock.writeLock().lock();
        try {
            ScheduledTask task = tasks.get(source.getId());
            if (task == null) {
                task = newTask(source, clock.instant().plus(source.getUpdateFrequency().offset()));
                tasks.put(source.getId(), task);
                log.info("Scheduled {} with {} frequency", source.getName(), source.getUpdateFrequency());
            } else {
                task.setFrequency(source.getUpdateFrequency());
                task.setPriority(source.getPriority());
                task.setMaxRetries(retryPolicy.maxRetriesFor(source.getUpdateFrequency()));
            }
            return Optional.of(task.snapshot());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean unschedule(UUID sourceId) {
        lock.writeLock().lock();
        try {
            boolean removed = tasks.remove(sourceId) != null;
            if (removed) {
                log.info("Unscheduled source {}", sourceId);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ScheduledTask newTask(DataSource source, Instant firstExecution) {
        return ScheduledTask.builder()
                .id(UUID.randomUUID())
                .sourceId(source.getId())
                .nextExecution(firstExecution)
                .frequency(source.getUpdateFrequency())
                .priority(source.getPriority())
                .retryCount(0)
                .maxRetries(retryPolicy.maxRetriesFor(source.getUpdateFrequency()))
                .status(TaskStatus.SCHEDULED)
                .build();
    }

    public void start() {
        if (tickLoop != null) {
            return;
        }
        startedAt = clock.instant();
        tickLoop = tickScheduler.scheduleWithFixedDelay(this::tick, tickInterval);
        log.info("Scheduler started, ticking every {}", tickInterval);
    }

    public void stop() {
        ScheduledFuture<?> loop = tickLoop;
        if (loop != null) {
            loop.cancel(false);
            tickLoop = null;
            log.info("Scheduler stopped");
        }
    }

    public boolean isRunning() {
        return tickLoop != null;
    }

    private void tick() {
        try {
            runTick(clock.instant()).whenComplete((summary, error) -> {
                if (error != null) {
                    log.error("Scheduler tick completed with an error: {}", error.getMessage(), error);
                } else if (!summary.results().isEmpty()) {
                    log.debug("Tick at {} finished: {} succeeded, {} failed, {} deferred", summary.tickTime(),
                            summary.count(TickSummary.Outcome.SUCCEEDED),
                            summary.count(TickSummary.Outcome.FAILED),
                            summary.count(TickSummary.Outcome.DEFERRED));
                }
            });
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Claims every task due at {@code now} and dispatches it. The returned future completes when
     * all dispatched executions have reported back.
     */
    public CompletableFuture<TickSummary> runTick(Instant now) {
        List<Claim> claims = claimDueTasks(now);
        if (claims.isEmpty()) {
            return CompletableFuture.completedFuture(TickSummary.empty(now));
        }
        log.debug("Dispatching {} due tasks", claims.size());
        List<CompletableFuture<TickSummary.TaskResult>> results = new ArrayList<>(claims.size());
        for (Claim claim : claims) {
            results.add(dispatch(claim));
        }
        return CompletableFuture.allOf(results.toArray(CompletableFuture[]::new))
                .thenApply(done -> new TickSummary(now, results.stream().map(CompletableFuture::join).toList()));
    }

    private List<Claim> claimDueTasks(Instant now) {
        lock.writeLock().lock();
        try {
            List<ScheduledTask> due = tasks.values().stream()
                    .filter(task -> task.isDue(now))
                    .sorted(DISPATCH_ORDER)
                    .toList();
            List<Claim> claims = new ArrayList<>(due.size());
            for (ScheduledTask task : due) {
                claims.add(new Claim(task.getSourceId(), task.getStatus()));
                task.setStatus(TaskStatus.RUNNING);
            }
            return claims;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private CompletableFuture<TickSummary.TaskResult> dispatch(Claim claim) {
        try {
            return CompletableFuture.supplyAsync(() -> execute(claim.sourceId()), workers);
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool saturated, deferring source {} to a later tick", claim.sourceId());
            revert(claim);
            return CompletableFuture.completedFuture(TickSummary.TaskResult.deferred(claim.sourceId()));
        }
    }

    private void revert(Claim claim) {
        lock.writeLock().lock();
        try {
            ScheduledTask task = tasks.get(claim.sourceId());
            if (task != null && task.getStatus() == TaskStatus.RUNNING) {
                task.setStatus(claim.previousStatus());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private TickSummary.TaskResult execute(UUID sourceId) {
        Optional<DataSource> source = sourceRegistry.get(sourceId).filter(DataSource::isActive);
        if (source.isEmpty()) {
            log.info("Source {} is no longer active, dropping its task", sourceId);
            unschedule(sourceId);
            return TickSummary.TaskResult.skipped(sourceId);
        }
        try {
            CollectionOutcome outcome = collectionExecutor.collect(sourceId);
            onSuccess(outcome);
            return TickSummary.TaskResult.succeeded(sourceId, outcome.records().size());
        } catch (CollectorException | RuntimeException e) {
            onFailure(source.get(), e);
            return TickSummary.TaskResult.failed(sourceId, e.getMessage());
        }
    }

    private void onSuccess(CollectionOutcome outcome) {
        totalExecutions.incrementAndGet();
        successfulExecutions.incrementAndGet();
        recordsProcessed.addAndGet(outcome.records().size());
        bytesCollected.addAndGet(outcome.bytesStored());
        executionMillis.addAndGet(outcome.duration().toMillis());
        lastCollectionTime = outcome.completedAt();

        lock.writeLock().lock();
        try {
            ScheduledTask task = tasks.get(outcome.sourceId());
            if (task == null) {
                return;
            }
            task.setStatus(TaskStatus.COMPLETED);
            task.setRetryCount(0);
            task.setConsecutiveFailures(0);
            task.setLastError(null);
            task.setLastSuccess(outcome.completedAt());
            task.setLastDuration(outcome.duration());
            task.setNextExecution(outcome.completedAt().plus(task.getFrequency().offset()));
            task.setStatus(TaskStatus.SCHEDULED);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void onFailure(DataSource source, Exception error) {
        totalExecutions.incrementAndGet();
        failedExecutions.incrementAndGet();
        Instant now = clock.instant();
        boolean exhausted;
        int maxRetries;

        lock.writeLock().lock();
        try {
            ScheduledTask task = tasks.get(source.getId());
            if (task == null) {
                return;
            }
            int retryCount = task.getRetryCount() + 1;
            task.setRetryCount(retryCount);
            task.setConsecutiveFailures(task.getConsecutiveFailures() + 1);
            task.setLastError(error.getMessage());
            maxRetries = task.getMaxRetries();
            exhausted = retryCount >= maxRetries;
            if (exhausted) {
                task.setStatus(TaskStatus.FAILED);
            } else {
                task.setStatus(TaskStatus.RETRYING);
                task.setNextExecution(now.plus(retryPolicy.nextDelay(retryCount)));
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (exhausted) {
            log.error("Collection for {} failed and exhausted its {} retries: {}",
                    source.getName(), maxRetries, error.getMessage(), error);
            markErrored(source.getId());
        } else {
            log.warn("Collection for {} failed, will retry: {}", source.getName(), error.getMessage());
        }
    }

    // A status an operator set while the run was in flight wins over ERROR.
    private void markErrored(UUID sourceId) {
        sourceRegistry.get(sourceId)
                .filter(DataSource::isActive)
                .ifPresent(current -> sourceRegistry.updateStatus(sourceId, SourceStatus.ERROR));
    }

    /**
     * Makes a scheduled source due immediately. Tasks that exhausted their retries must be
     * resumed instead.
     */
    public ScheduledTask forceCollection(UUID sourceId) {
        lock.writeLock().lock();
        try {
            ScheduledTask task = requireTask(sourceId);
            if (task.getStatus() == TaskStatus.FAILED) {
                throw new IllegalStateException("Task for source " + sourceId + " exhausted its retries and must be resumed");
            }
            if (task.getStatus() != TaskStatus.RUNNING) {
                task.setNextExecution(clock.instant());
                task.setStatus(TaskStatus.SCHEDULED);
            }
            return task.snapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Reactivates a source and clears its retry state so it runs on the next tick.
     */
    public ScheduledTask resume(UUID sourceId) {
        DataSource source = sourceRegistry.updateStatus(sourceId, SourceStatus.ACTIVE);
        lock.writeLock().lock();
        try {
            ScheduledTask task = tasks.get(sourceId);
            if (task == null) {
                task = newTask(source, clock.instant());
                tasks.put(sourceId, task);
            } else if (task.getStatus() != TaskStatus.RUNNING) {
                task.setRetryCount(0);
                task.setConsecutiveFailures(0);
                task.setStatus(TaskStatus.SCHEDULED);
                task.setNextExecution(clock.instant());
            }
            log.info("Resumed collection for {}", source.getName());
            return task.snapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ScheduledTask requireTask(UUID sourceId) {
        ScheduledTask task = tasks.get(sourceId);
        if (task == null) {
            if (!sourceRegistry.contains(sourceId)) {
                throw new SourceNotFoundException(sourceId);
            }
            throw new IllegalStateException("Source " + sourceId + " is not scheduled");
        }
        return task;
    }

    public Optional<ScheduledTask> getTask(UUID sourceId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tasks.get(sourceId)).map(ScheduledTask::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ScheduledTask> listTasks() {
        lock.readLock().lock();
        try {
            return tasks.values().stream()
                    .sorted(DISPATCH_ORDER)
                    .map(ScheduledTask::snapshot)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public SchedulerStats getStats() {
        Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
        lock.readLock().lock();
        try {
            tasks.values().forEach(task -> byStatus.merge(task.getStatus(), 1L, Long::sum));
        } finally {
            lock.readLock().unlock();
        }
        long executions = totalExecutions.get();
        Instant since = startedAt;
        return new SchedulerStats(
                executions,
                successfulExecutions.get(),
                failedExecutions.get(),
                recordsProcessed.get(),
                bytesCollected.get(),
                executions == 0 ? 0.0 : (double) executionMillis.get() / executions,
                lastCollectionTime,
                sourceRegistry.countByStatus(SourceStatus.ACTIVE),
                sourceRegistry.countByStatus(SourceStatus.ERROR),
                byStatus,
                since == null || !isRunning() ? Duration.ZERO : Duration.between(since, clock.instant()),
                isRunning());
    }

    private record Claim(UUID sourceId, TaskStatus previousStatus) {
    }
}
