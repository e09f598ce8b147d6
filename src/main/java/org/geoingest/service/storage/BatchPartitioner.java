package org.geoingest.service.storage;

import org.geoingest.models.domain.RawDataRecord;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Splits records into one batch per source and UTC hour. Batches come back in key order and
 * the records inside a batch in timestamp order, so the same input always lays out the same way.
 */
public final class BatchPartitioner {

    private static final Comparator<BatchKey> KEY_ORDER = Comparator
            .comparing(BatchKey::sourceId)
            .thenComparing(BatchKey::hour);

    private static final Comparator<RawDataRecord> RECORD_ORDER = Comparator
            .comparing(RawDataRecord::timestamp)
            .thenComparing(RawDataRecord::id);

    private BatchPartitioner() {
    }

    public static SortedMap<BatchKey, List<RawDataRecord>> partition(Collection<RawDataRecord> records) {
        SortedMap<BatchKey, List<RawDataRecord>> batches = new TreeMap<>(KEY_ORDER);
        for (RawDataRecord record : records) {
            batches.computeIfAbsent(BatchKey.of(record), key -> new ArrayList<>()).add(record);
        }
        batches.values().forEach(batch -> batch.sort(RECORD_ORDER));
        return batches;
    }

    public record BatchKey(UUID sourceId, Instant hour) {
        static BatchKey of(RawDataRecord record) {
            return new BatchKey(record.sourceId(), record.timestamp().truncatedTo(ChronoUnit.HOURS));
        }
    }
}
