package org.geoingest.models.dto;

import jakarta.validation.constraints.NotNull;
import org.geoingest.models.enums.SourceStatus;

public record StatusUpdateRequest(@NotNull SourceStatus status) {
}
