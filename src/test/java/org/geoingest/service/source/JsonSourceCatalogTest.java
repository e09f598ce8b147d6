package org.geoingest.service.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.geoingest.exception.ConfigurationException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.enums.DataSourceCategory;
import org.geoingest.models.enums.SourceStatus;
import org.geoingest.models.enums.UpdateFrequency;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSourceCatalogTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void loadsDefinitionsWithDefaults() {
        JsonSourceCatalog catalog = new JsonSourceCatalog(new ClassPathResource("catalog/test-sources.json"), objectMapper);

        List<DataSource> sources = catalog.loadSources();

        assertThat(sources).hasSize(3);
        DataSource stations = sources.get(0);
        assertThat(stations.getId()).isEqualTo(UUID.fromString("0b7a6f2e-3c1d-4e5f-8a9b-1c2d3e4f5a6b"));
        assertThat(stations.getCategory()).isEqualTo(DataSourceCategory.WEATHER_STATIONS);
        assertThat(stations.getUpdateFrequency()).isEqualTo(UpdateFrequency.HOURLY);
        assertThat(sources.get(1).getStatus()).isEqualTo(SourceStatus.ACTIVE);
        assertThat(sources.get(2).getStatus()).isEqualTo(SourceStatus.INACTIVE);
    }

    @Test
    void derivedIdsAreStableAcrossLoads() {
        JsonSourceCatalog catalog = new JsonSourceCatalog(new ClassPathResource("catalog/test-sources.json"), objectMapper);

        UUID first = catalog.loadSources().get(1).getId();
        UUID second = catalog.loadSources().get(1).getId();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void shippedCatalogIsValid() {
        JsonSourceCatalog catalog = new JsonSourceCatalog(new ClassPathResource("catalog/sources.json"), objectMapper);

        List<DataSource> sources = catalog.loadSources();

        assertThat(sources).isNotEmpty();
        assertThat(sources).extracting(DataSource::getId).doesNotHaveDuplicates();
        assertThat(sources).anyMatch(source -> !source.isActive());
    }

    @Test
    void missingCatalogIsAConfigurationError() {
        JsonSourceCatalog catalog = new JsonSourceCatalog(new ClassPathResource("catalog/absent.json"), objectMapper);

        assertThatThrownBy(catalog::loadSources).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void definitionWithoutCategoryIsRejected() {
        byte[] json = "[{\"name\":\"Broken\",\"provider\":\"X\",\"priority\":3}]".getBytes(StandardCharsets.UTF_8);
        JsonSourceCatalog catalog = new JsonSourceCatalog(new ByteArrayResource(json), objectMapper);

        assertThatThrownBy(catalog::loadSources)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("category");
    }
}
