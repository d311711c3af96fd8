package eu.virtualparadox.ragcore.exception;

/**
 * Raised when sizing or client settings make an operation impossible, e.g. an overlap that
 * is not strictly smaller than the chunk size. Never retried.
 */
public class InvalidConfigurationException extends RagCoreException {

    public InvalidConfigurationException(final String message) {
        super("invalid_configuration", message);
    }
}
