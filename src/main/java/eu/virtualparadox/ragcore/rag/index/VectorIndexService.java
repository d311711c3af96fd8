package eu.virtualparadox.ragcore.rag.index;

import eu.virtualparadox.ragcore.ingest.model.Chunk;
import eu.virtualparadox.ragcore.rag.index.model.IndexedChunk;
import eu.virtualparadox.ragcore.rag.index.model.NearestNeighborQuery;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over the vector index used for approximate nearest neighbor (ANN) search.
 * <p>
 * Implementations persist chunk-level vectors alongside the chunk text, metadata and
 * identifiers, partitioned by an opaque owner scope, and provide:
 * <ul>
 *   <li><b>Upsert</b>: add or replace all chunks for a document in one operation</li>
 *   <li><b>Delete</b>: remove all chunks belonging to a document or to a whole scope</li>
 *   <li><b>Nearest</b>: ANN lookup with metadata pre-filtering, ordered by ascending distance</li>
 * </ul>
 * <p>
 * Notes:
 * <ul>
 *   <li>All vectors supplied to {@link #upsert} MUST have the same dimension.</li>
 *   <li>Dimension must remain consistent across the entire index lifetime for a given vector field.</li>
 * </ul>
 */
public interface VectorIndexService {

    /**
     * Adds or replaces the indexed representation of all chunks for a document.
     *
     * @param ownerScope scope the document belongs to (non-blank)
     * @param documentId the parent document identifier (non-blank)
     * @param chunks     ordered chunks (non-empty)
     * @param vectors    one vector per chunk, same order and dimension
     * @param metadata   metadata attached to every chunk of the document (may be empty)
     * @throws IOException              if writing to the underlying index fails
     * @throws IllegalArgumentException if parameters are null/empty or sizes/dimensions mismatch
     */
    void upsert(String ownerScope,
                String documentId,
                List<Chunk> chunks,
                List<float[]> vectors,
                Map<String, String> metadata) throws IOException;

    /**
     * Removes all indexed chunks of a document within a scope.
     *
     * @throws IOException if the underlying index update fails
     */
    void deleteDocument(String ownerScope, String documentId) throws IOException;

    /**
     * Removes every chunk of a scope.
     *
     * @throws IOException if the underlying index update fails
     */
    void deleteScope(String ownerScope) throws IOException;

    /**
     * Runs a nearest-neighbour lookup.
     *
     * @param query vector, limit, scope and metadata predicates
     * @return at most {@code query.limit()} candidates, ascending by distance
     * @throws IOException if the index cannot be searched
     */
    List<IndexedChunk> nearest(NearestNeighborQuery query) throws IOException;
}
