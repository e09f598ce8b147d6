package org.geoingest.service.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.geoingest.exception.ConfigurationException;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.dto.DataSourceDTO;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads source definitions from a JSON array. Definitions without an id get one derived from
 * provider and name.
 */
@Slf4j
public class JsonSourceCatalog implements SourceCatalog {

    private static final TypeReference<List<DataSourceDTO>> DEFINITIONS = new TypeReference<>() {
    };

    private final Resource location;
    private final ObjectMapper objectMapper;

    public JsonSourceCatalog(Resource location, ObjectMapper objectMapper) {
        this.location = location;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<DataSource> loadSources() {
        if (!location.exists()) {
            throw new ConfigurationException("Source catalog not found: " + location.getDescription());
        }
        try (InputStream in = location.getInputStream()) {
            List<DataSourceDTO> definitions = objectMapper.readValue(in, DEFINITIONS);
            List<DataSource> sources = definitions.stream().map(DataSourceDTO::toDomain).toList();
            log.info("Loaded {} source definitions from {}", sources.size(), location.getDescription());
            return sources;
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid source catalog " + location.getDescription() + ": " + e.getMessage(), e);
        }
    }
}
