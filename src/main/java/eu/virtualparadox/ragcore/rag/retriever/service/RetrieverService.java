package eu.virtualparadox.ragcore.rag.retriever.service;

import eu.virtualparadox.ragcore.rag.retriever.model.SearchRequest;
import eu.virtualparadox.ragcore.rag.retriever.model.SearchResult;
import eu.virtualparadox.ragcore.util.CancellationSignal;
import eu.virtualparadox.ragcore.util.Futures;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface RetrieverService {

    /**
     * Runs the search without blocking the caller; the future fails with the same exceptions
     * the blocking variant throws.
     */
    CompletableFuture<List<SearchResult>> searchAsync(final SearchRequest request, final CancellationSignal cancellation);

    /**
     * Blocks the calling thread until the query is embedded (retries and backoff included) and
     * the index has answered.
     */
    default List<SearchResult> search(final SearchRequest request, final CancellationSignal cancellation) {
        return Futures.await(searchAsync(request, cancellation), cancellation);
    }

    default List<SearchResult> search(final SearchRequest request) {
        return search(request, CancellationSignal.none());
    }

}
