package eu.virtualparadox.ragcore.exception;

/**
 * Raised when the vector index cannot serve a lookup or a write.
 */
public class BackendUnavailableException extends RagCoreException {

    public BackendUnavailableException(final String message, final Throwable cause) {
        super("backend_unavailable", message, cause);
    }
}
