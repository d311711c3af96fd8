package eu.virtualparadox.ragcore.exception;

/**
 * Base type of every failure the retrieval core reports to its callers.
 * <p>Each subclass carries a stable {@code errorType} so a surrounding API layer can map it
 * to a response without inspecting the concrete class.</p>
 */
public abstract class RagCoreException extends RuntimeException {

    private final String errorType;

    protected RagCoreException(final String errorType, final String message) {
        super(message);
        this.errorType = errorType;
    }

    protected RagCoreException(final String errorType, final String message, final Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }
}
