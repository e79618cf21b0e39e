package fr.lapetina.batchinference.infrastructure.config;

/**
 * Raised for unusable configuration: unreadable YAML, or an engine started
 * without any backend client.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
