package viewchange.common;

/**
 * A node cannot start with the given configuration, e.g. its name is not in the
 * roster or the roster file cannot be parsed.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
