package org.geoingest.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.geoingest.models.domain.DataSource;
import org.geoingest.models.enums.DataFormat;
import org.geoingest.models.enums.DataSourceCategory;
import org.geoingest.models.enums.SourceStatus;
import org.geoingest.models.enums.UpdateFrequency;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DataSourceDTO(
        UUID id,
        @NotBlank String name,
        @NotNull DataSourceCategory category,
        @NotBlank String provider,
        String description,
        String apiEndpoint,
        DataFormat dataFormat,
        UpdateFrequency updateFrequency,
        List<String> parameters,
        @Min(1) @Max(10) Integer priority,
        SourceStatus status,
        Instant lastIngestion
) {
    private static final int DEFAULT_PRIORITY = 5;

    public DataSource toDomain() {
        return DataSource.builder()
                .id(id != null ? id : derivedId(provider, name))
                .name(name)
                .category(category)
                .provider(provider)
                .description(description)
                .apiEndpoint(apiEndpoint)
                .dataFormat(dataFormat)
                .updateFrequency(updateFrequency)
                .parameters(parameters)
                .priority(priority != null ? priority : DEFAULT_PRIORITY)
                .status(status)
                .lastIngestion(lastIngestion)
                .build();
    }

    public static DataSourceDTO from(DataSource source) {
        return new DataSourceDTO(
                source.getId(),
                source.getName(),
                source.getCategory(),
                source.getProvider(),
                source.getDescription(),
                source.getApiEndpoint(),
                source.getDataFormat(),
                source.getUpdateFrequency(),
                source.getParameters(),
                source.getPriority(),
                source.getStatus(),
                source.getLastIngestion()
        );
    }

    /** Stable id for definitions that do not carry one, so reloading a catalog upserts. */
    public static UUID derivedId(String provider, String name) {
        String key = (provider == null ? "" : provider) + "/" + name;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }
}
