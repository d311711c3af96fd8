package eu.virtualparadox.ragcore.rag.embed.provider;

/**
 * Failure reported by an {@link EmbeddingProvider}, already classified.
 * Never leaves the embedding client: it is either retried or converted into an
 * {@link eu.virtualparadox.ragcore.exception.EmbeddingServiceException}.
 */
public class ProviderException extends RuntimeException {

    private final EProviderError error;

    public ProviderException(final EProviderError error, final String message) {
        super(message);
        this.error = error;
    }

    public ProviderException(final EProviderError error, final String message, final Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public static ProviderException fromHttpStatus(final int status, final String body) {
        return new ProviderException(EProviderError.fromHttpStatus(status),
                "Embedding provider returned HTTP " + status + (body == null || body.isBlank() ? "" : ": " + body));
    }

    public EProviderError getError() {
        return error;
    }
}
