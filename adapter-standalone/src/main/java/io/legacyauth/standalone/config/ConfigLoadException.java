package io.legacyauth.standalone.config;

/**
 * Thrown when configuration loading fails: an explicit config file that does
 * not exist, invalid YAML, a non-numeric value, or a missing or malformed
 * {@code upstream}. The message is meant for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
