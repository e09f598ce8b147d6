package org.geoingest.exception;

public class ConfigurationException extends IngestionException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("CONFIGURATION_ERROR", message, cause);
    }
}
