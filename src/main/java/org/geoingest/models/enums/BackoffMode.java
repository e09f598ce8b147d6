package org.geoingest.models.enums;

public enum BackoffMode {
    FIXED,
    EXPONENTIAL
}
