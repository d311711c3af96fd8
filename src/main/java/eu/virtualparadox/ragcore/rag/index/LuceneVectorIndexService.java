package eu.virtualparadox.ragcore.rag.index;

import eu.virtualparadox.ragcore.exception.InvalidArgumentException;
import eu.virtualparadox.ragcore.ingest.model.Chunk;
import eu.virtualparadox.ragcore.rag.index.model.IndexedChunk;
import eu.virtualparadox.ragcore.rag.index.model.NearestNeighborQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import static eu.virtualparadox.ragcore.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 * <p>
 * Each chunk is stored as one Lucene {@link Document}:
 * <ul>
 *   <li>Identifiers and metadata are indexed as exact-match {@link StringField}s so they can
 *       pre-filter the ANN search</li>
 *   <li>Text content is stored for the search results</li>
 *   <li>Vectors are written via {@link KnnFloatVectorField} with cosine similarity</li>
 * </ul>
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code ownerScope}, {@code docId}, {@code chunkRef}: stored {@link StringField}s</li>
 *   <li>{@code docKey}: {@link StringField} combining scope and document id, the unit of replacement</li>
 *   <li>{@code meta.<key>}: stored {@link StringField} per metadata entry</li>
 *   <li>{@code chunkIndex}, {@code tokenCount}, {@code text}: {@link StoredField}s</li>
 *   <li>{@code vector}: {@link KnnFloatVectorField}, HNSW indexed</li>
 * </ul>
 *
 * <h3>Distance</h3>
 * For {@link VectorSimilarityFunction#COSINE} Lucene scores hits as {@code (1 + cos) / 2}. The
 * service reports cosine distance {@code 1 - cos = 2 - 2 * score}, within {@code [0, 2]}.
 *
 * <p><b>Vector dimensions:</b> Lucene requires a constant dimension per vector field across an index.
 * This implementation validates incoming vectors are consistent. If the embedding model (dimension)
 * changes, reindex into a fresh index directory.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class LuceneVectorIndexService implements VectorIndexService {

    private static final char DOC_KEY_SEPARATOR = '\u001F';

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * First-seen vector dimension of this index instance, {@code 0} until the first upsert.
     */
    private final AtomicInteger vectorDim = new AtomicInteger();

    /**
     * Adds or replaces all chunks for a given document.
     * <p>
     * Earlier chunks of the document are deleted and the new ones added in one atomic
     * {@link IndexWriter#updateDocuments} call, then committed and made visible to searchers.
     * </p>
     */
    @Override
    public void upsert(final String ownerScope,
                       final String documentId,
                       final List<Chunk> chunks,
                       final List<float[]> vectors,
                       final Map<String, String> metadata) throws IOException {

        requireNonNullOrEmpty(ownerScope, "ownerScope");
        requireNonNullOrEmpty(documentId, "documentId");
        requireNonNullOrEmpty(chunks, "chunks");
        requireNonNullOrEmpty(vectors, "vectors");

        if (chunks.size() != vectors.size()) {
            throw new InvalidArgumentException("chunks.size() != vectors.size()");
        }

        final int dim = vectors.get(0) == null ? 0 : vectors.get(0).length;
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new InvalidArgumentException("All vectors must be non-null and of length " + dim);
            }
        }
        ensureConsistentDimension(dim);

        final Map<String, String> safeMetadata = validateMetadata(metadata);
        final List<Document> documents = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            documents.add(buildLuceneDocument(ownerScope, documentId, chunks.get(i), vectors.get(i), safeMetadata));
        }

        writer.updateDocuments(new Term(FIELD_DOC_KEY, docKey(ownerScope, documentId)), documents);
        writer.commit();
        searcherManager.maybeRefreshBlocking();

        log.info("Indexed {} chunks of document {} in scope {}", documents.size(), documentId, ownerScope);
    }

    @Override
    public void deleteDocument(final String ownerScope, final String documentId) throws IOException {
        requireNonNullOrEmpty(ownerScope, "ownerScope");
        requireNonNullOrEmpty(documentId, "documentId");
        writer.deleteDocuments(new Term(FIELD_DOC_KEY, docKey(ownerScope, documentId)));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        log.info("Deleted document {} from scope {}", documentId, ownerScope);
    }

    @Override
    public void deleteScope(final String ownerScope) throws IOException {
        requireNonNullOrEmpty(ownerScope, "ownerScope");
        writer.deleteDocuments(new Term(FIELD_OWNER_SCOPE, ownerScope));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        log.info("Deleted scope {}", ownerScope);
    }

    /**
     * Runs a filtered ANN search. The scope and metadata predicates are applied as a Lucene
     * pre-filter, so the limit counts matching chunks only.
     */
    @Override
    public List<IndexedChunk> nearest(final NearestNeighborQuery query) throws IOException {
        requireNonNullOrEmpty(query.ownerScope(), "ownerScope");
        if (query.vector() == null || query.vector().length == 0) {
            throw new InvalidArgumentException("query vector must not be empty");
        }
        if (query.limit() < 1) {
            throw new InvalidArgumentException("limit must be at least 1");
        }
        final int dim = vectorDim.get();
        if (dim != 0 && dim != query.vector().length) {
            throw new InvalidArgumentException(
                    "Query vector dimension mismatch. Index=" + dim + ", query=" + query.vector().length);
        }

        final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(
                FIELD_VECTOR, query.vector(), query.limit(), buildFilter(query));

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(knn, query.limit());
            final StoredFields storedFields = searcher.storedFields();

            final List<IndexedChunk> results = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                results.add(toIndexedChunk(storedFields.document(sd.doc), sd.score));
            }
            return results;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Conjunction of the owner scope and every metadata predicate, in key order.
     */
    private static BooleanQuery buildFilter(final NearestNeighborQuery query) {
        final BooleanQuery.Builder filter = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_OWNER_SCOPE, query.ownerScope())), BooleanClause.Occur.FILTER);
        for (final Map.Entry<String, String> predicate : query.filter().entrySet()) {
            filter.add(new TermQuery(new Term(METADATA_PREFIX + predicate.getKey(), predicate.getValue())),
                    BooleanClause.Occur.FILTER);
        }
        return filter.build();
    }

    private static IndexedChunk toIndexedChunk(final Document doc, final float score) {
        final Map<String, String> metadata = new TreeMap<>();
        for (final IndexableField field : doc.getFields()) {
            if (field.name().startsWith(METADATA_PREFIX)) {
                metadata.put(field.name().substring(METADATA_PREFIX.length()), field.stringValue());
            }
        }

        return new IndexedChunk(
                doc.get(FIELD_CHUNK_REF),
                doc.get(FIELD_DOC_ID),
                doc.getField(FIELD_CHUNK_INDEX).numericValue().intValue(),
                doc.get(FIELD_TEXT),
                Collections.unmodifiableMap(metadata),
                toDistance(score));
    }

    /**
     * Converts a Lucene cosine score {@code (1 + cos) / 2} into cosine distance {@code 1 - cos}.
     */
    static double toDistance(final float score) {
        final double distance = 2.0 - 2.0 * score;
        return Math.max(0.0, Math.min(2.0, distance));
    }

    /**
     * Ensures an internal, stable notion of the vector dimension.
     *
     * @param dim proposed dimension
     * @throws InvalidArgumentException if a different dimension has already been established
     */
    private void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new InvalidArgumentException("Vector dimension must be > 0");
        }
        if (dim > HighDimensionVectorsFormat.MAX_DIMENSIONS) {
            throw new InvalidArgumentException("Vector dimension " + dim + " exceeds "
                    + HighDimensionVectorsFormat.MAX_DIMENSIONS);
        }
        // first time we see vectors; cache the dimension
        final int existing = vectorDim.compareAndExchange(0, dim);
        if (existing != 0 && existing != dim) {
            throw new InvalidArgumentException(
                    "Vector dimension mismatch. Existing=" + existing + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    private static Map<String, String> validateMetadata(final Map<String, String> metadata) {
        if (metadata == null) {
            return Collections.emptyMap();
        }
        for (final Map.Entry<String, String> entry : metadata.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new InvalidArgumentException("metadata keys must not be blank");
            }
            if (entry.getValue() == null) {
                throw new InvalidArgumentException("metadata value for '" + entry.getKey() + "' must not be null");
            }
        }
        return new TreeMap<>(metadata);
    }

    /**
     * Builds a Lucene {@link Document} for a single chunk+vector pair.
     */
    private static Document buildLuceneDocument(final String ownerScope,
                                                final String documentId,
                                                final Chunk c,
                                                final float[] vec,
                                                final Map<String, String> metadata) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_OWNER_SCOPE, ownerScope, Field.Store.YES));
        d.add(new StringField(FIELD_DOC_ID, documentId, Field.Store.YES));
        d.add(new StringField(FIELD_DOC_KEY, docKey(ownerScope, documentId), Field.Store.NO));
        d.add(new StringField(FIELD_CHUNK_REF, chunkRef(documentId, c.index()), Field.Store.YES));

        for (final Map.Entry<String, String> entry : metadata.entrySet()) {
            d.add(new StringField(METADATA_PREFIX + entry.getKey(), entry.getValue(), Field.Store.YES));
        }

        d.add(new StoredField(FIELD_CHUNK_INDEX, c.index()));
        d.add(new StoredField(FIELD_TOKEN_COUNT, c.tokenCount()));
        d.add(new StoredField(FIELD_TEXT, c.text()));

        // Vector for HNSW ANN search
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));

        return d;
    }

    static String chunkRef(final String documentId, final int chunkIndex) {
        return String.format(Locale.ROOT, "%s_%05d", documentId, chunkIndex);
    }

    private static String docKey(final String ownerScope, final String documentId) {
        return ownerScope + DOC_KEY_SEPARATOR + documentId;
    }

    /**
     * Utility to assert a required string or collection is non-null/non-empty.
     *
     * @param value value to check
     * @param name  parameter name for error messaging
     */
    private static void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new InvalidArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new InvalidArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new InvalidArgumentException(name + " must not be empty");
        }
    }
}
