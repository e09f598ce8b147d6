package org.geoingest.models.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.geoingest.models.enums.DataFormat;
import org.geoingest.models.enums.DataSourceCategory;
import org.geoingest.models.enums.SourceStatus;
import org.geoingest.models.enums.UpdateFrequency;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A registered provider of observational data. Instances are immutable; status and
 * last-ingestion changes produce a replacement through {@link #toBuilder()}.
 */
@Getter
@EqualsAndHashCode
@ToString(of = {"id", "name", "category", "provider", "status", "priority"})
public class DataSource {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    private final UUID id;
    private final String name;
    private final DataSourceCategory category;
    private final String provider;
    private final String description;
    private final String apiEndpoint;
    private final DataFormat dataFormat;
    private final UpdateFrequency updateFrequency;
    private final List<String> parameters;
    private final int priority;
    private final SourceStatus status;
    private final Instant lastIngestion;

    @Builder(toBuilder = true)
    private DataSource(UUID id,
                       String name,
                       DataSourceCategory category,
                       String provider,
                       String description,
                       String apiEndpoint,
                       DataFormat dataFormat,
                       UpdateFrequency updateFrequency,
                       List<String> parameters,
                       int priority,
                       SourceStatus status,
                       Instant lastIngestion) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority must be between 1 and 10, got " + priority);
        }
        this.id = required(id, "id");
        this.name = required(name, "name");
        this.category = required(category, "category");
        this.provider = provider;
        this.description = description;
        this.apiEndpoint = apiEndpoint;
        this.dataFormat = dataFormat == null ? DataFormat.JSON : dataFormat;
        this.updateFrequency = updateFrequency == null ? UpdateFrequency.IRREGULAR : updateFrequency;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.priority = priority;
        this.status = status == null ? SourceStatus.ACTIVE : status;
        this.lastIngestion = lastIngestion;
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Data source " + field + " is required");
        }
        return value;
    }

    public boolean isActive() {
        return status == SourceStatus.ACTIVE;
    }
}
