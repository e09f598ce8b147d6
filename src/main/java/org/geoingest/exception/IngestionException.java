package org.geoingest.exception;

/**
 * Base class for runtime failures raised by the ingestion core. The error code is stable
 * and is what the REST layer reports to clients.
 */
public class IngestionException extends RuntimeException {
    private final String errorCode;

    public IngestionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public IngestionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
