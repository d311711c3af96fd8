package eu.virtualparadox.ragcore.rag.retriever.service;

import eu.virtualparadox.ragcore.exception.BackendUnavailableException;
import eu.virtualparadox.ragcore.exception.InvalidArgumentException;
import eu.virtualparadox.ragcore.rag.embed.EmbeddingClient;
import eu.virtualparadox.ragcore.rag.index.VectorIndexService;
import eu.virtualparadox.ragcore.rag.index.model.IndexedChunk;
import eu.virtualparadox.ragcore.rag.index.model.NearestNeighborQuery;
import eu.virtualparadox.ragcore.rag.retriever.model.SearchRequest;
import eu.virtualparadox.ragcore.rag.retriever.model.SearchResult;
import eu.virtualparadox.ragcore.util.CancellationSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Provides semantic query capabilities over the vector index.
 * <p>
 * Steps:
 * <ol>
 *   <li>Validate the request</li>
 *   <li>Embed the query using {@link EmbeddingClient}</li>
 *   <li>Run a filtered nearest-neighbour lookup through {@link VectorIndexService}</li>
 *   <li>Derive {@code score = 1 - distance} and drop results below the threshold</li>
 * </ol>
 * Results keep the order returned by the index. Embedding failures propagate unchanged; index
 * failures are reported as {@link BackendUnavailableException}. Nothing is retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class KnnRetrieverService implements RetrieverService {

    private final EmbeddingClient embeddingClient;
    private final VectorIndexService vectorIndexService;

    /**
     * Executes a semantic search against the index.
     * <p>
     * The request is validated on the calling thread. The index lookup runs on the common pool
     * once the query vector is available, not on the thread that completed the embedding.
     * </p>
     *
     * @param request      scope, query, limit, filter and threshold
     * @param cancellation aborts the query embedding when fired
     * @return future of {@link SearchResult} objects (never null); fails with
     *         {@link BackendUnavailableException} if the index lookup fails
     * @throws InvalidArgumentException if the request is out of range
     */
    @Override
    public CompletableFuture<List<SearchResult>> searchAsync(final SearchRequest request,
                                                             final CancellationSignal cancellation) {
        validate(request);

        return embeddingClient.embedBatch(List.of(request.query()), null, cancellation)
                .thenApplyAsync(vectors -> {
                    cancellation.throwIfCancelled();
                    return lookup(request, vectors.get(0));
                });
    }

    private List<SearchResult> lookup(final SearchRequest request, final float[] vector) {
        final List<IndexedChunk> candidates;
        try {
            candidates = vectorIndexService.nearest(new NearestNeighborQuery(
                    vector, request.maxResults(), request.ownerScope(), request.filter()));
        } catch (final IOException | RuntimeException e) {
            log.error("Vector index lookup failed for scope {}", request.ownerScope(), e);
            throw new BackendUnavailableException("Vector index lookup failed: " + e.getMessage(), e);
        }

        final List<SearchResult> results = new ArrayList<>(candidates.size());
        for (final IndexedChunk candidate : candidates) {
            final double score = 1.0 - candidate.distance();
            if (request.scoreThreshold() != null && score < request.scoreThreshold()) {
                continue;
            }
            results.add(new SearchResult(
                    candidate.chunkRef(),
                    candidate.documentId(),
                    candidate.chunkIndex(),
                    candidate.text(),
                    candidate.distance(),
                    score,
                    candidate.metadata()));
        }

        log.debug("Search in scope {} returned {} of {} candidates", request.ownerScope(), results.size(), candidates.size());
        return results;
    }

    private static void validate(final SearchRequest request) {
        if (request == null) {
            throw new InvalidArgumentException("request cannot be null");
        }
        if (StringUtils.isBlank(request.ownerScope())) {
            throw new InvalidArgumentException("ownerScope cannot be blank");
        }
        if (StringUtils.isBlank(request.query())) {
            throw new InvalidArgumentException("query cannot be blank");
        }
        if (request.maxResults() < SearchRequest.MIN_RESULTS || request.maxResults() > SearchRequest.MAX_RESULTS) {
            throw new InvalidArgumentException("maxResults must be between " + SearchRequest.MIN_RESULTS
                    + " and " + SearchRequest.MAX_RESULTS + ", got " + request.maxResults());
        }
        request.filter().forEach((key, value) -> {
            if (StringUtils.isBlank(key) || value == null) {
                throw new InvalidArgumentException("filter entries need a non-blank key and a value");
            }
        });
        final Double threshold = request.scoreThreshold();
        if (threshold != null && (threshold.isNaN() || threshold < 0.0 || threshold > 1.0)) {
            throw new InvalidArgumentException("scoreThreshold must be within [0, 1], got " + threshold);
        }
    }
}
