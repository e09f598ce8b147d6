package org.geoingest.exception;

import java.util.UUID;

public class SourceNotFoundException extends IngestionException {
    private final UUID sourceId;

    public SourceNotFoundException(UUID sourceId) {
        super("SOURCE_NOT_FOUND", "Data source not found: " + sourceId);
        this.sourceId = sourceId;
    }

    public UUID getSourceId() {
        return sourceId;
    }
}
