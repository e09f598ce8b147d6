package org.geoingest.exception;

/**
 * Raised by collector adapters when a provider cannot be reached or its response cannot be
 * parsed. Checked, because callers are expected to turn it into retry state.
 */
public class CollectorException extends Exception {
    private final String provider;

    public CollectorException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public CollectorException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
