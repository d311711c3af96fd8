package eu.virtualparadox.ragcore.exception;

import eu.virtualparadox.ragcore.rag.embed.provider.EProviderError;

/**
 * Terminal embedding failure: either the provider reported a non-retryable error, or every
 * allowed attempt failed with a retryable one.
 */
public class EmbeddingServiceException extends RagCoreException {

    private final EProviderError providerError;
    private final int attempts;

    public EmbeddingServiceException(final EProviderError providerError,
                                     final int attempts,
                                     final String message,
                                     final Throwable cause) {
        super("embedding_service_error", message, cause);
        this.providerError = providerError;
        this.attempts = attempts;
    }

    /**
     * @return classification of the last provider failure seen
     */
    public EProviderError getProviderError() {
        return providerError;
    }

    /**
     * @return number of provider calls made for the failing batch
     */
    public int getAttempts() {
        return attempts;
    }
}
