package org.geoingest.models.dto;

import java.time.Instant;

public record StorageStats(
        long totalRecords,
        long fileCount,
        long totalSize,
        long compressedSize,
        double compressionRatio,
        Instant oldestRecord,
        Instant newestRecord,
        long sourceCount
) {
}
