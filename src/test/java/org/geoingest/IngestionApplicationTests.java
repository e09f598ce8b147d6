package org.geoingest;

import org.geoingest.exception.ConfigurationException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.dto.StorageStats;
import org.geoingest.service.IngestionCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class IngestionApplicationTests {

    @Autowired
    private IngestionCoordinator coordinator;

    @Test
    void catalogIsLoadedOnStartup() {
        assertThat(coordinator.listSources()).extracting(DataSource::getName)
                .contains("Test Weather Stations", "Test Satellite", "Dormant Feed");
        assertThat(coordinator.getSource(UUID.fromString("0b7a6f2e-3c1d-4e5f-8a9b-1c2d3e4f5a6b")).getName())
                .isEqualTo("Test Weather Stations");
        assertThat(coordinator.isRunning()).isFalse();
    }

    @Test
    void ingestionDoesNotStartWithoutCollectors() {
        assertThatThrownBy(coordinator::startIngestion)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Test Weather Stations")
                .hasMessageNotContaining("Dormant Feed");
        assertThat(coordinator.isRunning()).isFalse();
    }

    @Test
    void emptyStoreReportsZeroTotals() {
        StorageStats stats = coordinator.getStorageStats();

        assertThat(stats.fileCount()).isZero();
        assertThat(stats.compressionRatio()).isZero();
    }
}
