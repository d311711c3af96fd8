package eu.virtualparadox.ragcore.rag.embed.provider;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One call to an external embedding model.
 * <p>
 * Implementations embed exactly the given batch in one request and complete with one vector per
 * input, in input order. Failures complete the future exceptionally with a
 * {@link ProviderException}. Cancelling the returned future should abort the request.
 * Batching, retries and backoff are the caller's concern.
 * </p>
 */
public interface EmbeddingProvider {

    /**
     * @param texts batch to embed (non-empty, within the provider's item limit)
     * @param model provider-specific model identifier
     * @return future of vectors, {@code result.get(i)} belongs to {@code texts.get(i)}
     */
    CompletableFuture<List<float[]>> embed(List<String> texts, String model);

    /**
     * @return short identifier used in logs
     */
    String name();
}
