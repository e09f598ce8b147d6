package org.geoingest.models.dto;

import org.geoingest.models.domain.ScheduledTask;
import org.geoingest.models.enums.TaskStatus;
import org.geoingest.models.enums.UpdateFrequency;

import java.time.Instant;
import java.util.UUID;

public record ScheduledTaskDTO(
        UUID id,
        UUID sourceId,
        Instant nextExecution,
        UpdateFrequency frequency,
        int priority,
        int retryCount,
        int maxRetries,
        Instant lastSuccess,
        String lastError,
        TaskStatus status
) {
    public static ScheduledTaskDTO from(ScheduledTask task) {
        return new ScheduledTaskDTO(
                task.getId(),
                task.getSourceId(),
                task.getNextExecution(),
                task.getFrequency(),
                task.getPriority(),
                task.getRetryCount(),
                task.getMaxRetries(),
                task.getLastSuccess(),
                task.getLastError(),
                task.getStatus());
    }
}
