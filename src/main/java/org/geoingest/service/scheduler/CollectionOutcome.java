package org.geoingest.service.scheduler;

import org.geoingest.models.domain.RawDataRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record CollectionOutcome(
        UUID sourceId,
        List<RawDataRecord> records,
        int rejectedCount,
        int fileCount,
        long bytesStored,
        Duration duration,
        Instant completedAt
) {
}
