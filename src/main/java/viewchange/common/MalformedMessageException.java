package viewchange.common;

/**
 * Raised when bytes received from the network cannot be decoded into a
 * well-formed message: truncated frames, unknown or mismatched message
 * types, or payloads whose fields fail validation.
 */
public class MalformedMessageException extends Exception {
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
