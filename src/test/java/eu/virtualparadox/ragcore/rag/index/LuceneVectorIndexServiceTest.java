package eu.virtualparadox.ragcore.rag.index;

import eu.virtualparadox.ragcore.application.config.LuceneConfig;
import eu.virtualparadox.ragcore.exception.InvalidArgumentException;
import eu.virtualparadox.ragcore.ingest.model.Chunk;
import eu.virtualparadox.ragcore.rag.index.model.IndexedChunk;
import eu.virtualparadox.ragcore.rag.index.model.NearestNeighborQuery;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LuceneVectorIndexServiceTest {

    private static final float[] X = {1f, 0f, 0f};
    private static final float[] Y = {0f, 1f, 0f};
    private static final float[] MINUS_X = {-1f, 0f, 0f};

    private Directory directory;
    private IndexWriter writer;
    private SearcherManager searcherManager;
    private LuceneVectorIndexService index;

    @BeforeEach
    void setUp() throws IOException {
        directory = new ByteBuffersDirectory();
        writer = new IndexWriter(directory, LuceneConfig.indexWriterConfig());
        searcherManager = new SearcherManager(writer, null);
        index = new LuceneVectorIndexService(writer, searcherManager);
    }

    @AfterEach
    void tearDown() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }

    private static List<Chunk> chunks(final String... texts) {
        final Chunk[] chunks = new Chunk[texts.length];
        for (int i = 0; i < texts.length; i++) {
            chunks[i] = new Chunk(i, texts[i], 1);
        }
        return List.of(chunks);
    }

    private List<IndexedChunk> nearest(final String scope, final float[] vector, final int limit, final Map<String, String> filter)
            throws IOException {
        return index.nearest(new NearestNeighborQuery(vector, limit, scope, filter));
    }

    @Test
    @DisplayName("Results come back in ascending cosine distance with stored fields")
    void nearest_ordersByDistance() throws IOException {
        index.upsert("tenant", "doc", chunks("same", "orthogonal", "opposite"), List.of(X, Y, MINUS_X), Map.of("lang", "en"));

        final List<IndexedChunk> results = nearest("tenant", X, 10, null);

        assertThat(results).extracting(IndexedChunk::text).containsExactly("same", "orthogonal", "opposite");
        assertThat(results.get(0).distance()).isCloseTo(0.0, within(1e-6));
        assertThat(results.get(1).distance()).isCloseTo(1.0, within(1e-6));
        assertThat(results.get(2).distance()).isCloseTo(2.0, within(1e-6));

        final IndexedChunk first = results.get(0);
        assertThat(first.chunkRef()).isEqualTo("doc_00000");
        assertThat(first.documentId()).isEqualTo("doc");
        assertThat(first.chunkIndex()).isZero();
        assertThat(first.metadata()).containsExactly(Map.entry("lang", "en"));
    }

    @Test
    @DisplayName("The limit caps the number of results")
    void nearest_respectsLimit() throws IOException {
        index.upsert("tenant", "doc", chunks("a", "b", "c"), List.of(X, Y, MINUS_X), Map.of());

        assertThat(nearest("tenant", X, 2, null)).extracting(IndexedChunk::text).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Chunks of other owner scopes are never returned")
    void nearest_isolatesScopes() throws IOException {
        index.upsert("tenant-a", "doc", chunks("from a"), List.of(X), Map.of());
        index.upsert("tenant-b", "doc", chunks("from b"), List.of(X), Map.of());

        assertThat(nearest("tenant-a", X, 10, null)).extracting(IndexedChunk::text).containsExactly("from a");
        assertThat(nearest("tenant-b", X, 10, null)).extracting(IndexedChunk::text).containsExactly("from b");
        assertThat(nearest("tenant-c", X, 10, null)).isEmpty();
    }

    @Test
    @DisplayName("Metadata filters are applied before ranking and combine conjunctively")
    void nearest_appliesMetadataFilter() throws IOException {
        index.upsert("tenant", "en-doc", chunks("english"), List.of(Y), Map.of("lang", "en", "kind", "manual"));
        index.upsert("tenant", "de-doc", chunks("deutsch"), List.of(X), Map.of("lang", "de", "kind", "manual"));
        index.upsert("tenant", "en-faq", chunks("faq"), List.of(MINUS_X), Map.of("lang", "en", "kind", "faq"));

        final List<IndexedChunk> english = nearest("tenant", X, 1, Map.of("lang", "en"));
        assertThat(english).extracting(IndexedChunk::text).containsExactly("english");

        final List<IndexedChunk> englishFaq = nearest("tenant", X, 10, Map.of("lang", "en", "kind", "faq"));
        assertThat(englishFaq).extracting(IndexedChunk::text).containsExactly("faq");

        assertThat(nearest("tenant", X, 10, Map.of("lang", "fr"))).isEmpty();
    }

    @Test
    @DisplayName("Upserting a document again replaces its earlier chunks")
    void upsert_replacesDocument() throws IOException {
        index.upsert("tenant", "doc", chunks("old 1", "old 2"), List.of(X, Y), Map.of());
        index.upsert("tenant", "doc", chunks("new"), List.of(X), Map.of());

        assertThat(nearest("tenant", X, 10, null)).extracting(IndexedChunk::text).containsExactly("new");
    }

    @Test
    @DisplayName("Deleting a document or a scope removes their chunks only")
    void delete_removesChunks() throws IOException {
        index.upsert("tenant", "keep", chunks("keep"), List.of(X), Map.of());
        index.upsert("tenant", "drop", chunks("drop"), List.of(X), Map.of());
        index.upsert("other", "drop", chunks("other"), List.of(X), Map.of());

        index.deleteDocument("tenant", "drop");
        assertThat(nearest("tenant", X, 10, null)).extracting(IndexedChunk::text).containsExactly("keep");
        assertThat(nearest("other", X, 10, null)).extracting(IndexedChunk::text).containsExactly("other");

        index.deleteScope("tenant");
        assertThat(nearest("tenant", X, 10, null)).isEmpty();
        assertThat(nearest("other", X, 10, null)).hasSize(1);
    }

    @Test
    @DisplayName("Inconsistent input is rejected")
    void upsert_invalidInput_throws() throws IOException {
        assertThatThrownBy(() -> index.upsert("tenant", "doc", chunks("a", "b"), List.of(X), Map.of()))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> index.upsert("tenant", "doc", chunks("a", "b"), List.of(X, new float[]{1f, 0f}), Map.of()))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> index.upsert(" ", "doc", chunks("a"), List.of(X), Map.of()))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> index.upsert("tenant", "doc", List.of(), List.of(), Map.of()))
                .isInstanceOf(InvalidArgumentException.class);

        index.upsert("tenant", "doc", chunks("a"), List.of(X), Map.of());
        assertThatThrownBy(() -> index.upsert("tenant", "doc2", chunks("b"), List.of(new float[]{1f, 0f}), Map.of()))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("dimension mismatch");
        assertThatThrownBy(() -> nearest("tenant", new float[]{1f, 0f}, 10, null))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("Vectors above Lucene's default dimension limit are indexed and survive a reopen")
    void upsert_highDimensionalVectors_roundTrip(@TempDir final Path dir) throws IOException {
        final float[] vector = new float[1536];
        vector[7] = 1f;

        try (Directory fsDirectory = FSDirectory.open(dir);
             IndexWriter fsWriter = new IndexWriter(fsDirectory, LuceneConfig.indexWriterConfig());
             SearcherManager fsSearcherManager = new SearcherManager(fsWriter, null)) {
            new LuceneVectorIndexService(fsWriter, fsSearcherManager)
                    .upsert("tenant", "large", chunks("wide"), List.of(vector), Map.of());
        }

        try (Directory fsDirectory = FSDirectory.open(dir);
             DirectoryReader reader = DirectoryReader.open(fsDirectory)) {
            assertThat(reader.numDocs()).isEqualTo(1);
        }

        try (Directory fsDirectory = FSDirectory.open(dir);
             IndexWriter fsWriter = new IndexWriter(fsDirectory, LuceneConfig.indexWriterConfig());
             SearcherManager fsSearcherManager = new SearcherManager(fsWriter, null)) {
            final List<IndexedChunk> results = new LuceneVectorIndexService(fsWriter, fsSearcherManager)
                    .nearest(new NearestNeighborQuery(vector, 5, "tenant", null));
            assertThat(results).extracting(IndexedChunk::text).containsExactly("wide");
        }
    }

    @Test
    @DisplayName("Lucene cosine scores map to cosine distance")
    void toDistance_convertsScores() {
        assertThat(LuceneVectorIndexService.toDistance(1f)).isEqualTo(0.0);
        assertThat(LuceneVectorIndexService.toDistance(0.5f)).isEqualTo(1.0);
        assertThat(LuceneVectorIndexService.toDistance(0f)).isEqualTo(2.0);
        assertThat(LuceneVectorIndexService.toDistance(1.0000001f)).isEqualTo(0.0);
    }
}
