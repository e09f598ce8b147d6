package org.geoingest.models.dto;

import org.geoingest.models.domain.RawDataRecord;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Filters for reading stored records. Every field is optional; time bounds are inclusive and
 * parameters match when a record carries any of them.
 */
public record RawDataQuery(
        UUID sourceId,
        Instant timeStart,
        Instant timeEnd,
        List<String> parameters,
        Integer limit
) {
    public RawDataQuery {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("Query limit must be positive, got " + limit);
        }
        if (timeStart != null && timeEnd != null && timeEnd.isBefore(timeStart)) {
            throw new IllegalArgumentException("Query time range ends before it starts");
        }
    }

    public static RawDataQuery all() {
        return new RawDataQuery(null, null, null, List.of(), null);
    }

    public static RawDataQuery forSource(UUID sourceId) {
        return new RawDataQuery(sourceId, null, null, List.of(), null);
    }

    public RawDataQuery withTimeRange(Instant start, Instant end) {
        return new RawDataQuery(sourceId, start, end, parameters, limit);
    }

    public RawDataQuery withParameters(List<String> names) {
        return new RawDataQuery(sourceId, timeStart, timeEnd, names, limit);
    }

    public RawDataQuery withLimit(int max) {
        return new RawDataQuery(sourceId, timeStart, timeEnd, parameters, max);
    }

    public int effectiveLimit(int defaultLimit) {
        return limit != null ? limit : defaultLimit;
    }

    public boolean matches(RawDataRecord record) {
        if (sourceId != null && !sourceId.equals(record.sourceId())) {
            return false;
        }
        if (timeStart != null && record.timestamp().isBefore(timeStart)) {
            return false;
        }
        if (timeEnd != null && record.timestamp().isAfter(timeEnd)) {
            return false;
        }
        return parameters.isEmpty() || record.hasAnyParameter(parameters);
    }
}
