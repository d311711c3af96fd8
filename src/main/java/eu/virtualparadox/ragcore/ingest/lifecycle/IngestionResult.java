package eu.virtualparadox.ragcore.ingest.lifecycle;

import eu.virtualparadox.ragcore.ingest.model.Chunk;

import java.util.List;

/**
 * @param ownerScope scope the document was stored in
 * @param documentId identifier of the ingested document
 * @param chunks     the chunks that were embedded and indexed, in document order
 */
public record IngestionResult(String ownerScope, String documentId, List<Chunk> chunks) {

    public int chunkCount() {
        return chunks.size();
    }
}
