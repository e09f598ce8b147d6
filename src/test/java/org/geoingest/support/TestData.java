package org.geoingest.support;

import org.geoingest.models.domain.DataMetadata;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.domain.RawDataRecord;
import org.geoingest.models.enums.DataSourceCategory;
import org.geoingest.models.enums.SourceStatus;
import org.geoingest.models.enums.UpdateFrequency;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class TestData {

    private TestData() {
    }

    public static DataSource source(String name, DataSourceCategory category, UpdateFrequency frequency, int priority) {
        return DataSource.builder()
                .id(UUID.randomUUID())
                .name(name)
                .category(category)
                .provider("TestProvider")
                .updateFrequency(frequency)
                .parameters(List.of("air_temperature"))
                .priority(priority)
                .status(SourceStatus.ACTIVE)
                .build();
    }

    public static DataSource hourlyStation(String name) {
        return source(name, DataSourceCategory.WEATHER_STATIONS, UpdateFrequency.HOURLY, 5);
    }

    public static RawDataRecord record(UUID sourceId, Instant timestamp, String... parameters) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String parameter : parameters) {
            values.put(parameter, 21.5);
        }
        DataMetadata metadata = new DataMetadata(values, Map.of(), null, null, null, null, null);
        return new RawDataRecord(UUID.randomUUID(), sourceId, timestamp, timestamp,
                Map.of("station", "ST-01", "value", 21.5), metadata, List.of(), null);
    }
}
