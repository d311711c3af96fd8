package eu.virtualparadox.ragcore.rag.index.model;

import java.util.Map;

/**
 * Candidate row returned by a nearest-neighbour lookup.
 *
 * @param chunkRef   opaque identifier of the stored chunk
 * @param documentId parent document identifier
 * @param chunkIndex position of the chunk within its document
 * @param text       stored chunk text
 * @param metadata   metadata stored with the chunk
 * @param distance   cosine distance to the query vector, {@code [0, 2]}, lower is closer
 */
public record IndexedChunk(String chunkRef,
                           String documentId,
                           int chunkIndex,
                           String text,
                           Map<String, String> metadata,
                           double distance) {
}
