package org.geoingest.models.domain;

import org.geoingest.models.enums.QualitySeverity;

public record QualityFlag(
        String parameter,
        String flag,
        String description,
        QualitySeverity severity
) {
}
