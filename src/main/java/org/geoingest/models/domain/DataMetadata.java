package org.geoingest.models.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DataMetadata(
        Map<String, Object> parameters,
        Map<String, String> units,
        Coordinates coordinates,
        Double elevation,
        String instrumentInfo,
        String processingLevel,
        String version
) {
    public DataMetadata {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        units = units == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(units));
    }

    public static DataMetadata empty() {
        return new DataMetadata(Map.of(), Map.of(), null, null, null, null, null);
    }
}
