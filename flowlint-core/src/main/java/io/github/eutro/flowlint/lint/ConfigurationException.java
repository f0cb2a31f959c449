package io.github.eutro.flowlint.lint;

/**
 * Thrown when a run is misconfigured, before any analysis starts.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
