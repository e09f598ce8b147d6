package org.geoingest.models.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One collected observation. The payload is opaque to the ingestion core; only the
 * metadata parameter names take part in query filtering.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawDataRecord(
        UUID id,
        UUID sourceId,
        Instant timestamp,
        Instant ingestionTime,
        Map<String, Object> data,
        DataMetadata metadata,
        List<QualityFlag> qualityFlags,
        String filePath
) {
    public RawDataRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(timestamp, "timestamp");
        data = data == null ? Map.of() : data;
        metadata = metadata == null ? DataMetadata.empty() : metadata;
        qualityFlags = qualityFlags == null ? List.of() : List.copyOf(qualityFlags);
    }

    public boolean hasAnyParameter(Collection<String> names) {
        return names.stream().anyMatch(metadata.parameters()::containsKey);
    }
}
