package org.geoingest.models.dto;

import org.geoingest.models.enums.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record SchedulerStats(
        long totalExecutions,
        long successfulExecutions,
        long failedExecutions,
        long recordsProcessed,
        long bytesCollected,
        double averageExecutionMillis,
        Instant lastCollectionTime,
        long activeSources,
        long errorSources,
        Map<TaskStatus, Long> tasksByStatus,
        Duration uptime,
        boolean running
) {
}
