package org.geoingest.service;

import org.geoingest.adapters.CollectorRegistry;
import org.geoingest.exception.CollectorException;
import org.geoingest.exception.ConfigurationException;
import org.geoingest.exception.SourceNotFoundException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.domain.ScheduledTask;
import org.geoingest.models.enums.DataSourceCategory;
import org.geoingest.models.enums.SourceStatus;
import org.geoingest.models.enums.UpdateFrequency;
import org.geoingest.service.scheduler.CollectionExecutor;
import org.geoingest.service.scheduler.CollectionOutcome;
import org.geoingest.service.scheduler.IngestionScheduler;
import org.geoingest.service.scheduler.RetryPolicy;
import org.geoingest.service.source.SourceCatalog;
import org.geoingest.service.source.SourceRegistry;
import org.geoingest.service.storage.StorageEngine;
import org.geoingest.support.FakeCollector;
import org.geoingest.support.MutableClock;
import org.geoingest.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionCoordinatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final SourceRegistry sourceRegistry = new SourceRegistry();
    private final FakeCollector stations = new FakeCollector(DataSourceCategory.WEATHER_STATIONS);
    private final CollectorRegistry collectorRegistry = new CollectorRegistry(List.of(stations));
    private final SourceCatalog catalog = mock(SourceCatalog.class);
    private final StorageEngine storageEngine = mock(StorageEngine.class);
    private final TaskScheduler taskScheduler = mock(TaskScheduler.class);

    private IngestionScheduler scheduler;
    private IngestionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        when(storageEngine.storeBatch(anyCollection())).thenReturn(List.of());
        doReturn(mock(ScheduledFuture.class)).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        CollectionExecutor executor = new CollectionExecutor(sourceRegistry, collectorRegistry, storageEngine, clock);
        scheduler = new IngestionScheduler(sourceRegistry, executor, RetryPolicy.fixed(3, Duration.ofMinutes(5)),
                Runnable::run, taskScheduler, clock, Duration.ofSeconds(60));
        coordinator = new IngestionCoordinator(sourceRegistry, collectorRegistry, catalog, scheduler, executor, storageEngine);
    }

    @Test
    void startRefusesActiveSourcesWithoutACollector() {
        coordinator.registerSource(TestData.hourlyStation("Station"));
        coordinator.registerSource(TestData.source("Radar", DataSourceCategory.GROUND_BASED_RADAR, UpdateFrequency.HOURLY, 5));

        assertThatThrownBy(coordinator::startIngestion)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("GROUND_BASED_RADAR")
                .hasMessageContaining("Radar");
        assertThat(coordinator.isRunning()).isFalse();
        verify(taskScheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
    }

    @Test
    void inactiveSourcesDoNotNeedACollector() {
        DataSource station = coordinator.registerSource(TestData.hourlyStation("Station"));
        coordinator.registerSource(TestData.source("Radar", DataSourceCategory.GROUND_BASED_RADAR, UpdateFrequency.HOURLY, 5)
                .toBuilder().status(SourceStatus.INACTIVE).build());

        coordinator.startIngestion();

        assertThat(coordinator.isRunning()).isTrue();
        assertThat(coordinator.listTasks()).extracting(ScheduledTask::getSourceId).containsExactly(station.getId());
    }

    @Test
    void sourcesRegisteredWhileRunningAreScheduledImmediately() {
        coordinator.startIngestion();

        DataSource late = coordinator.registerSource(TestData.hourlyStation("Late station"));

        assertThat(scheduler.getTask(late.getId())).isPresent();
        assertThatThrownBy(() -> coordinator.registerSource(
                TestData.source("Radar", DataSourceCategory.GROUND_BASED_RADAR, UpdateFrequency.HOURLY, 5)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void deactivatingASourceRemovesItsTask() {
        DataSource station = coordinator.registerSource(TestData.hourlyStation("Station"));
        coordinator.startIngestion();

        coordinator.updateSourceStatus(station.getId(), SourceStatus.INACTIVE);

        assertThat(coordinator.listTasks()).isEmpty();
        assertThat(coordinator.getSource(station.getId()).getStatus()).isEqualTo(SourceStatus.INACTIVE);
    }

    @Test
    void activatingAnUncoveredSourceWhileRunningChangesNothing() {
        DataSource radar = coordinator.registerSource(TestData.source("Radar", DataSourceCategory.GROUND_BASED_RADAR, UpdateFrequency.HOURLY, 5)
                .toBuilder().status(SourceStatus.INACTIVE).build());
        coordinator.startIngestion();

        assertThatThrownBy(() -> coordinator.updateSourceStatus(radar.getId(), SourceStatus.ACTIVE))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("GROUND_BASED_RADAR");

        assertThat(coordinator.getSource(radar.getId()).getStatus()).isEqualTo(SourceStatus.INACTIVE);
        assertThat(scheduler.getTask(radar.getId())).isEmpty();
    }

    @Test
    void resumingAnUncoveredSourceWhileRunningIsRejected() {
        DataSource radar = coordinator.registerSource(TestData.source("Radar", DataSourceCategory.GROUND_BASED_RADAR, UpdateFrequency.HOURLY, 5)
                .toBuilder().status(SourceStatus.ERROR).build());
        coordinator.startIngestion();

        assertThatThrownBy(() -> coordinator.resumeSource(radar.getId()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Radar");

        assertThat(coordinator.getSource(radar.getId()).getStatus()).isEqualTo(SourceStatus.ERROR);
        assertThat(scheduler.getTask(radar.getId())).isEmpty();
    }

    @Test
    void resumingACoveredSourceSchedulesItNow() {
        DataSource station = coordinator.registerSource(TestData.hourlyStation("Station")
                .toBuilder().status(SourceStatus.ERROR).build());
        coordinator.startIngestion();

        ScheduledTask task = coordinator.resumeSource(station.getId());

        assertThat(task.getNextExecution()).isEqualTo(T0);
        assertThat(coordinator.getSource(station.getId()).getStatus()).isEqualTo(SourceStatus.ACTIVE);
    }

    @Test
    void manualCollectionStoresAndStampsTheSource() throws Exception {
        DataSource station = coordinator.registerSource(TestData.hourlyStation("Station"));

        CollectionOutcome outcome = coordinator.collectFromSource(station.getId());

        assertThat(outcome.records()).hasSize(1);
        assertThat(coordinator.getSource(station.getId()).getLastIngestion()).isEqualTo(T0);
    }

    @Test
    void manualCollectionErrorsReachTheCaller() {
        DataSource station = coordinator.registerSource(TestData.hourlyStation("Station"));
        stations.failing();

        assertThatThrownBy(() -> coordinator.collectFromSource(station.getId()))
                .isInstanceOf(CollectorException.class)
                .hasMessage("provider unavailable");
        assertThatThrownBy(() -> coordinator.collectFromSource(UUID.randomUUID()))
                .isInstanceOf(SourceNotFoundException.class);
    }

    @Test
    void catalogSourcesAreRegistered() {
        when(catalog.loadSources()).thenReturn(List.of(
                TestData.hourlyStation("Station A"),
                TestData.source("Station B", DataSourceCategory.WEATHER_STATIONS, UpdateFrequency.DAILY, 8)));

        int loaded = coordinator.initializeSources();

        assertThat(loaded).isEqualTo(2);
        assertThat(coordinator.listSources()).extracting(DataSource::getName)
                .containsExactly("Station B", "Station A");
    }

    @Test
    void collectorQueriesGoThroughTheCategoryCollector() throws Exception {
        DataSource station = coordinator.registerSource(TestData.hourlyStation("Station"));

        assertThat(coordinator.validateConnection(station.getId())).isTrue();
        assertThat(coordinator.getAvailableParameters(station.getId())).containsExactly("air_temperature");
        assertThat(coordinator.estimateDataVolume(station.getId())).isEqualTo(1024L);
    }

    @Test
    void stoppingCancelsTheTickLoop() {
        coordinator.startIngestion();
        coordinator.startIngestion();

        coordinator.stopIngestion();

        assertThat(coordinator.isRunning()).isFalse();
        verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
    }
}
