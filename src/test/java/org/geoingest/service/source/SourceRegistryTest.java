package org.geoingest.service.source;

import org.geoingest.exception.SourceNotFoundException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.enums.DataSourceCategory;
import org.geoingest.models.enums.SourceStatus;
import org.geoingest.models.enums.UpdateFrequency;
import org.geoingest.support.TestData;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRegistryTest {

    private final SourceRegistry registry = new SourceRegistry();

    @Test
    void registerIsAnUpsertById() {
        DataSource original = TestData.hourlyStation("Station");
        registry.register(original);
        registry.register(original.toBuilder().name("Renamed station").build());

        assertThat(registry.listAll()).hasSize(1);
        assertThat(registry.get(original.getId())).get().extracting(DataSource::getName).isEqualTo("Renamed station");
    }

    @Test
    void getReturnsEmptyForUnknownId() {
        assertThat(registry.get(UUID.randomUUID())).isEmpty();
        assertThatThrownBy(() -> registry.require(UUID.randomUUID())).isInstanceOf(SourceNotFoundException.class);
    }

    @Test
    void listActiveOrdersByDescendingPriorityAndSkipsInactive() {
        DataSource low = TestData.source("Low", DataSourceCategory.CLIMATE_DATA, UpdateFrequency.MONTHLY, 2);
        DataSource high = TestData.source("High", DataSourceCategory.SATELLITE_IMAGING, UpdateFrequency.DAILY, 9);
        DataSource mid = TestData.source("Mid", DataSourceCategory.WEATHER_STATIONS, UpdateFrequency.HOURLY, 5);
        DataSource paused = TestData.source("Paused", DataSourceCategory.WEATHER_STATIONS, UpdateFrequency.HOURLY, 10)
                .toBuilder().status(SourceStatus.MAINTENANCE).build();
        List.of(low, high, mid, paused).forEach(registry::register);

        assertThat(registry.listActive()).extracting(DataSource::getName).containsExactly("High", "Mid", "Low");
        assertThat(registry.listAll()).hasSize(4);
    }

    @Test
    void statusAndIngestionUpdatesReplaceTheValue() {
        DataSource source = registry.register(TestData.hourlyStation("Station"));
        Instant ingested = Instant.parse("2024-03-01T10:00:00Z");

        DataSource errored = registry.updateStatus(source.getId(), SourceStatus.ERROR);
        DataSource marked = registry.markIngested(source.getId(), ingested);

        assertThat(errored.getStatus()).isEqualTo(SourceStatus.ERROR);
        assertThat(marked.getLastIngestion()).isEqualTo(ingested);
        assertThat(marked.getStatus()).isEqualTo(SourceStatus.ERROR);
        assertThat(source.getStatus()).isEqualTo(SourceStatus.ACTIVE);
        assertThat(registry.listActive()).isEmpty();
        assertThat(registry.countByStatus(SourceStatus.ERROR)).isEqualTo(1);
    }

    @Test
    void updatesOfUnknownSourcesFail() {
        assertThatThrownBy(() -> registry.updateStatus(UUID.randomUUID(), SourceStatus.INACTIVE))
                .isInstanceOf(SourceNotFoundException.class);
    }

    @Test
    void priorityOutsideRangeIsRejected() {
        assertThatThrownBy(() -> TestData.source("Bad", DataSourceCategory.CLIMATE_DATA, UpdateFrequency.DAILY, 11))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TestData.source("Bad", DataSourceCategory.CLIMATE_DATA, UpdateFrequency.DAILY, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentRegistrationsAreAllRetained() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    registry.register(TestData.hourlyStation("Station " + n));
                    registry.listActive();
                }));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(registry.listActive()).hasSize(200);
    }
}
