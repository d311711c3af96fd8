package eu.virtualparadox.ragcore.ingest.lifecycle;

import eu.virtualparadox.ragcore.exception.BackendUnavailableException;
import eu.virtualparadox.ragcore.exception.InvalidArgumentException;
import eu.virtualparadox.ragcore.ingest.chunker.Chunker;
import eu.virtualparadox.ragcore.ingest.extractor.TextExtractor;
import eu.virtualparadox.ragcore.ingest.model.Chunk;
import eu.virtualparadox.ragcore.rag.embed.EmbeddingClient;
import eu.virtualparadox.ragcore.rag.index.VectorIndexService;
import eu.virtualparadox.ragcore.util.CancellationSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates the indexing pipeline for documents:
 * <ol>
 *     <li>Extract plain text from uploaded files ({@link TextExtractor})</li>
 *     <li>Split the text into token-bounded chunks ({@link Chunker})</li>
 *     <li>Embed the chunks to dense vectors ({@link EmbeddingClient})</li>
 *     <li>Upsert chunks + vectors + metadata into the vector index, replacing earlier chunks
 *         of the same document</li>
 * </ol>
 * The unit of work is one document per call.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    public static final String FILENAME_METADATA_KEY = "filename";

    private final TextExtractor textExtractor;
    private final Chunker chunker;
    private final EmbeddingClient embeddingClient;
    private final VectorIndexService vectorIndexService;

    public IngestionResult ingest(final String ownerScope,
                                  final String documentId,
                                  final String text,
                                  final Map<String, String> metadata) {
        return ingest(ownerScope, documentId, text, metadata, CancellationSignal.none());
    }

    /**
     * Chunks, embeds and indexes {@code text} as document {@code documentId}.
     * <p>
     * Text without content produces no chunks; then neither the embedding provider nor the
     * index is called.
     * </p>
     * <p>
     * Blocks the calling thread while the chunks are embedded, retries and backoff included;
     * call it from a worker thread.
     * </p>
     *
     * @param ownerScope   scope the document belongs to
     * @param documentId   document identifier, unique within the scope
     * @param text         document text
     * @param metadata     metadata stored with every chunk (may be {@code null})
     * @param cancellation checked while chunking and embedding
     * @return what was indexed
     * @throws BackendUnavailableException if the index write fails
     */
    public IngestionResult ingest(final String ownerScope,
                                  final String documentId,
                                  final String text,
                                  final Map<String, String> metadata,
                                  final CancellationSignal cancellation) {
        requireId(ownerScope, "ownerScope");
        requireId(documentId, "documentId");

        final List<Chunk> chunks = chunker.split(text, chunker.getChunkSize(), chunker.getOverlap(), cancellation);
        if (chunks.isEmpty()) {
            log.info("Document {} in scope {} has no content, nothing to index", documentId, ownerScope);
            return new IngestionResult(ownerScope, documentId, Collections.emptyList());
        }

        final List<String> texts = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            texts.add(chunk.text());
        }
        final List<float[]> vectors = embeddingClient.embedBatchSync(texts, null, cancellation);
        cancellation.throwIfCancelled();

        try {
            vectorIndexService.upsert(ownerScope, documentId, chunks, vectors,
                    metadata == null ? Collections.emptyMap() : metadata);
        } catch (final IOException e) {
            throw new BackendUnavailableException("Failed to index document " + documentId, e);
        }

        log.info("Ingested document {} in scope {} as {} chunks", documentId, ownerScope, chunks.size());
        return new IngestionResult(ownerScope, documentId, List.copyOf(chunks));
    }

    public IngestionResult ingestFile(final String ownerScope,
                                      final String documentId,
                                      final String fileName,
                                      final byte[] content,
                                      final Map<String, String> metadata) {
        return ingestFile(ownerScope, documentId, fileName, content, metadata, CancellationSignal.none());
    }

    /**
     * Extracts the text of an uploaded file and ingests it. The file name is stored with every
     * chunk under {@value #FILENAME_METADATA_KEY}.
     *
     * @throws InvalidArgumentException if the file type is unsupported or the file cannot be parsed
     */
    public IngestionResult ingestFile(final String ownerScope,
                                      final String documentId,
                                      final String fileName,
                                      final byte[] content,
                                      final Map<String, String> metadata,
                                      final CancellationSignal cancellation) {
        final String text = textExtractor.extractText(fileName, content);

        final Map<String, String> fileMetadata = new LinkedHashMap<>();
        if (metadata != null) {
            fileMetadata.putAll(metadata);
        }
        fileMetadata.put(FILENAME_METADATA_KEY, fileName);

        return ingest(ownerScope, documentId, text, fileMetadata, cancellation);
    }

    /**
     * Removes every chunk of a document.
     *
     * @throws BackendUnavailableException if the index update fails
     */
    public void delete(final String ownerScope, final String documentId) {
        requireId(ownerScope, "ownerScope");
        requireId(documentId, "documentId");
        try {
            vectorIndexService.deleteDocument(ownerScope, documentId);
        } catch (final IOException e) {
            throw new BackendUnavailableException("Failed to delete document " + documentId, e);
        }
    }

    /**
     * Removes every chunk of every document in a scope.
     *
     * @throws BackendUnavailableException if the index update fails
     */
    public void deleteScope(final String ownerScope) {
        requireId(ownerScope, "ownerScope");
        try {
            vectorIndexService.deleteScope(ownerScope);
        } catch (final IOException e) {
            throw new BackendUnavailableException("Failed to delete scope " + ownerScope, e);
        }
    }

    private static void requireId(final String value, final String name) {
        if (StringUtils.isBlank(value)) {
            throw new InvalidArgumentException(name + " cannot be blank");
        }
    }
}
