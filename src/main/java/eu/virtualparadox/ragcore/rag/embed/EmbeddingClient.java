package eu.virtualparadox.ragcore.rag.embed;

import eu.virtualparadox.ragcore.exception.EmbeddingServiceException;
import eu.virtualparadox.ragcore.util.CancellationSignal;
import eu.virtualparadox.ragcore.util.Futures;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Computes dense vector embeddings for chunks and queries.
 */
public interface EmbeddingClient {

    /**
     * Embeds {@code texts} in input order.
     * <p>
     * The future completes with exactly one vector per text, {@code result.get(i)} belonging to
     * {@code texts.get(i)}, or exceptionally with an {@link EmbeddingServiceException} (no
     * partial results) or an {@link eu.virtualparadox.ragcore.exception.OperationCancelledException}.
     * An empty input completes immediately without calling the provider.
     * </p>
     *
     * @param texts        texts to embed (non-null, no null elements)
     * @param model        provider model id, or {@code null} for the configured default
     * @param cancellation aborts in-flight provider calls and pending backoff when fired
     * @return future of vectors
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts, String model, CancellationSignal cancellation);

    default CompletableFuture<List<float[]>> embedBatch(final List<String> texts, final String model) {
        return embedBatch(texts, model, CancellationSignal.none());
    }

    /**
     * Blocking variant of {@link #embedBatch(List, String, CancellationSignal)} for callers on
     * worker threads.
     */
    default List<float[]> embedBatchSync(final List<String> texts,
                                         final String model,
                                         final CancellationSignal cancellation) {
        return Futures.await(embedBatch(texts, model, cancellation), cancellation);
    }

    /**
     * Embeds a single query string with the default model (a one-item batch).
     *
     * @param text         the query string
     * @param cancellation abort signal
     * @return the query vector
     */
    default float[] embedQuery(final String text, final CancellationSignal cancellation) {
        return embedBatchSync(List.of(text), null, cancellation).get(0);
    }
}
