package eu.virtualparadox.ragcore.ingest.model;

/**
 * Immutable slice of a source document produced by the chunker.
 *
 * @param index      0-based position within the document, contiguous
 * @param text       non-blank chunk content, overlap prefix included
 * @param tokenCount number of model tokens in {@code text}
 */
public record Chunk(int index, String text, int tokenCount) {
}
