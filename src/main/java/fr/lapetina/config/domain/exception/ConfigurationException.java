package fr.lapetina.config.domain.exception;

/**
 * Exception for invalid configuration assembly, detected before any query is possible.
 *
 * Raised for:
 * - Malformed or duplicate command line switch mappings
 * - Invalid builder input
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
