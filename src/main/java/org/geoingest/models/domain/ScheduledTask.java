package org.geoingest.models.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import org.geoingest.models.enums.TaskStatus;
import org.geoingest.models.enums.UpdateFrequency;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Scheduling state for one active source. Mutated only by the scheduler while it holds
 * the task table lock; callers outside the scheduler receive copies from {@link #snapshot()}.
 */
@Getter
@Setter
@Builder(toBuilder = true)
public class ScheduledTask {
    private final UUID id;
    private final UUID sourceId;
    private Instant nextExecution;
    private UpdateFrequency frequency;
    private int priority;
    private int retryCount;
    private int maxRetries;
    private Instant lastSuccess;
    private String lastError;
    private TaskStatus status;
    private int consecutiveFailures;
    private Duration lastDuration;

    public boolean isDue(Instant now) {
        return status.isDueCandidate() && !nextExecution.isAfter(now);
    }

    public ScheduledTask snapshot() {
        return toBuilder().build();
    }
}
