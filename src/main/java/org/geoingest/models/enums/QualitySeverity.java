package org.geoingest.models.enums;

public enum QualitySeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
