package org.geoingest.models.enums;

public enum TaskStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    RETRYING;

    public boolean isDueCandidate() {
        return this == SCHEDULED || this == RETRYING;
    }
}
