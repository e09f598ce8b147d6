package org.geoingest.models.enums;

public enum SourceStatus {
    ACTIVE,
    INACTIVE,
    ERROR,
    MAINTENANCE,
    RATE_LIMITED,
    AUTHENTICATION_FAILED
}
