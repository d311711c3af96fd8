package eu.virtualparadox.ragcore.exception;

/**
 * Raised when a caller passes an argument outside the accepted domain. Never retried.
 */
public class InvalidArgumentException extends RagCoreException {

    public InvalidArgumentException(final String message) {
        super("invalid_argument", message);
    }

    public InvalidArgumentException(final String message, final Throwable cause) {
        super("invalid_argument", message, cause);
    }
}
