package org.geoingest.repository;

import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.geoingest.models.entity.DataFileMetadata;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.UUID;

/**
 * Batch-level pre-filters for candidate files. These only prune; the storage engine still
 * filters every decoded record.
 */
public final class DataFileMetadataSpecifications {

    private DataFileMetadataSpecifications() {
    }

    public static Specification<DataFileMetadata> forSource(UUID sourceId) {
        return (root, query, cb) -> sourceId == null ? null : cb.equal(root.get("sourceId"), sourceId);
    }

    // File ranges are stored widened to whole microseconds, so the bounds are compared at that precision.
    public static Specification<DataFileMetadata> endsAtOrAfter(Instant start) {
        return (root, query, cb) -> start == null
                ? null
                : cb.greaterThanOrEqualTo(root.get("timeRangeEnd"), start.truncatedTo(ChronoUnit.MICROS));
    }

    public static Specification<DataFileMetadata> startsAtOrBefore(Instant end) {
        return (root, query, cb) -> end == null ? null : cb.lessThanOrEqualTo(root.get("timeRangeStart"), end.truncatedTo(ChronoUnit.MICROS));
    }

    public static Specification<DataFileMetadata> hasAnyParameter(Collection<String> parameters) {
        return (root, query, cb) -> {
            if (parameters == null || parameters.isEmpty()) {
                return null;
            }
            Subquery<UUID> subquery = query.subquery(UUID.class);
            Root<DataFileMetadata> candidate = subquery.from(DataFileMetadata.class);
            Join<DataFileMetadata, String> parameter = candidate.join("parameters");
            subquery.select(candidate.get("fileId"))
                    .where(cb.equal(candidate.get("fileId"), root.get("fileId")),
                            parameter.in(parameters));
            return cb.exists(subquery);
        };
    }
}
