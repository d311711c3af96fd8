package eu.virtualparadox.ragcore.rag.retriever.model;

import java.util.Map;

/**
 * @param chunkRef   opaque identifier of the stored chunk
 * @param documentId identifier of the parent document
 * @param chunkIndex position of the chunk inside the document
 * @param text       the chunk text
 * @param distance   cosine distance to the query, {@code [0, 2]}
 * @param score      {@code 1 - distance}; higher is better
 * @param metadata   metadata stored with the chunk
 */
public record SearchResult(String chunkRef,
                           String documentId,
                           int chunkIndex,
                           String text,
                           double distance,
                           double score,
                           Map<String, String> metadata) {

}
