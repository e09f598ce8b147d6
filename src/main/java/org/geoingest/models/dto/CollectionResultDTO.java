package org.geoingest.models.dto;

import org.geoingest.service.scheduler.CollectionOutcome;

import java.time.Instant;
import java.util.UUID;

public record CollectionResultDTO(
        UUID sourceId,
        int recordCount,
        int rejectedCount,
        int fileCount,
        long bytesStored,
        long durationMillis,
        Instant completedAt
) {
    public static CollectionResultDTO from(CollectionOutcome outcome) {
        return new CollectionResultDTO(
                outcome.sourceId(),
                outcome.records().size(),
                outcome.rejectedCount(),
                outcome.fileCount(),
                outcome.bytesStored(),
                outcome.duration().toMillis(),
                outcome.completedAt());
    }
}
