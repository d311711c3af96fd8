package eu.virtualparadox.ragcore.exception;

/**
 * Raised when a caller-supplied cancellation signal fired (explicit cancel or deadline)
 * before the operation completed.
 */
public class OperationCancelledException extends RagCoreException {

    public OperationCancelledException(final String message) {
        super("cancelled", message);
    }

    public OperationCancelledException(final String message, final Throwable cause) {
        super("cancelled", message, cause);
    }
}
