package eu.virtualparadox.ragcore.ingest.lifecycle;

import eu.virtualparadox.ragcore.application.config.ApplicationConfig;
import eu.virtualparadox.ragcore.application.config.LuceneConfig;
import eu.virtualparadox.ragcore.exception.BackendUnavailableException;
import eu.virtualparadox.ragcore.exception.InvalidArgumentException;
import eu.virtualparadox.ragcore.ingest.chunker.Chunker;
import eu.virtualparadox.ragcore.ingest.cleaner.TextCleaner;
import eu.virtualparadox.ragcore.ingest.extractor.DocumentTextExtractor;
import eu.virtualparadox.ragcore.ingest.model.Chunk;
import eu.virtualparadox.ragcore.ingest.tokenizer.TokenCounter;
import eu.virtualparadox.ragcore.rag.embed.RecordingBackoffScheduler;
import eu.virtualparadox.ragcore.rag.embed.RetryingEmbeddingClient;
import eu.virtualparadox.ragcore.rag.embed.ScriptedEmbeddingProvider;
import eu.virtualparadox.ragcore.rag.embed.provider.HashEmbeddingProvider;
import eu.virtualparadox.ragcore.rag.embed.retry.FailureClassifier;
import eu.virtualparadox.ragcore.rag.index.LuceneVectorIndexService;
import eu.virtualparadox.ragcore.rag.index.VectorIndexService;
import eu.virtualparadox.ragcore.rag.index.model.IndexedChunk;
import eu.virtualparadox.ragcore.rag.index.model.NearestNeighborQuery;
import eu.virtualparadox.ragcore.rag.retriever.model.SearchRequest;
import eu.virtualparadox.ragcore.rag.retriever.model.SearchResult;
import eu.virtualparadox.ragcore.rag.retriever.service.KnnRetrieverService;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class IngestionServiceTest {

    private static final TokenCounter TOKEN_COUNTER = new TokenCounter("o200k_base");
    private static final int DIMENSIONS = 16;

    private Directory directory;
    private IndexWriter writer;
    private SearcherManager searcherManager;
    private LuceneVectorIndexService index;
    private RetryingEmbeddingClient embeddingClient;
    private DocumentTextExtractor extractor;

    private static ApplicationConfig config() {
        final ApplicationConfig config = new ApplicationConfig();
        config.getEmbedding().setDimensions(DIMENSIONS);
        config.getEmbedding().setInitialBackoff(Duration.ofMillis(1));
        return config;
    }

    private IngestionService service(final Chunker chunker) {
        return new IngestionService(extractor, chunker, embeddingClient, index);
    }

    private List<IndexedChunk> everything(final String scope) throws IOException {
        final float[] probe = new HashEmbeddingProvider(DIMENSIONS).embed(List.of("probe"), null).join().get(0);
        return index.nearest(new NearestNeighborQuery(probe, 100, scope, null));
    }

    @BeforeEach
    void setUp() throws IOException {
        directory = new ByteBuffersDirectory();
        writer = new IndexWriter(directory, LuceneConfig.indexWriterConfig());
        searcherManager = new SearcherManager(writer, null);
        index = new LuceneVectorIndexService(writer, searcherManager);
        embeddingClient = new RetryingEmbeddingClient(new HashEmbeddingProvider(DIMENSIONS), new FailureClassifier(),
                RecordingBackoffScheduler.immediate(), config());
        extractor = new DocumentTextExtractor(new TextCleaner());
    }

    @AfterEach
    void tearDown() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }

    @Test
    @DisplayName("Three short paragraphs become three chunks that can be searched")
    void ingest_thenSearch_findsChunks() {
        final Chunker chunker = new Chunker(TOKEN_COUNTER, TOKEN_COUNTER.count("A.") + 1, 0);
        final IngestionService ingestion = service(chunker);

        final IngestionResult result = ingestion.ingest("tenant", "abc", "A.\n\nB.\n\nC.", Map.of("lang", "en"));

        assertEquals(3, result.chunkCount());
        assertThat(result.chunks()).extracting(Chunk::text).containsExactly("A.", "B.", "C.");
        assertThat(result.chunks()).extracting(Chunk::index).containsExactly(0, 1, 2);

        final KnnRetrieverService retriever = new KnnRetrieverService(embeddingClient, index);
        final List<SearchResult> hits = retriever.search(new SearchRequest("tenant", "B.", 3, Map.of("lang", "en"), null));

        assertThat(hits).hasSize(3);
        assertThat(hits.get(0).text()).isEqualTo("B.");
        assertThat(hits.get(0).chunkRef()).isEqualTo("abc_00001");
        assertThat(hits.get(0).score()).isGreaterThan(0.999);
        assertThat(hits).extracting(SearchResult::documentId).containsOnly("abc");
    }

    @Test
    @DisplayName("Blank text indexes nothing and never calls the provider")
    void ingest_blankText_noEmbedding() throws IOException {
        final ScriptedEmbeddingProvider provider = new ScriptedEmbeddingProvider();
        embeddingClient = new RetryingEmbeddingClient(provider, new FailureClassifier(),
                RecordingBackoffScheduler.immediate(), config());

        final IngestionResult result = service(new Chunker(TOKEN_COUNTER, 50, 10))
                .ingest("tenant", "empty", " \n\n\t ", null);

        assertThat(result.chunks()).isEmpty();
        assertThat(provider.callCount()).isZero();
        assertThat(everything("tenant")).isEmpty();
    }

    @Test
    @DisplayName("Re-ingesting a document replaces its chunks")
    void ingest_twice_replacesChunks() throws IOException {
        final IngestionService ingestion = service(new Chunker(TOKEN_COUNTER, 50, 0));

        ingestion.ingest("tenant", "doc", "First version.", null);
        ingestion.ingest("tenant", "doc", "Second version.", null);

        assertThat(everything("tenant")).extracting(IndexedChunk::text).containsExactly("Second version.");
    }

    @Test
    @DisplayName("Files are extracted, cleaned and tagged with their file name")
    void ingestFile_addsFileNameMetadata() throws IOException {
        final IngestionService ingestion = service(new Chunker(TOKEN_COUNTER, 50, 0));
        final byte[] content = "Hello\r\nworld\u00A0 again".getBytes(StandardCharsets.UTF_8);

        final IngestionResult result = ingestion.ingestFile("tenant", "notes", "notes.md", content, Map.of("lang", "en"));

        assertThat(result.chunks()).extracting(Chunk::text).containsExactly("Hello\nworld again");
        final List<IndexedChunk> stored = everything("tenant");
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).metadata())
                .containsEntry(IngestionService.FILENAME_METADATA_KEY, "notes.md")
                .containsEntry("lang", "en");
    }

    @Test
    @DisplayName("Unsupported files are rejected before anything is indexed")
    void ingestFile_unsupportedType_throws() throws IOException {
        final IngestionService ingestion = service(new Chunker(TOKEN_COUNTER, 50, 0));

        assertThatThrownBy(() -> ingestion.ingestFile("tenant", "bin", "image.png", new byte[]{1, 2, 3}, null))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("Unsupported file type");
        assertThat(everything("tenant")).isEmpty();
    }

    @Test
    @DisplayName("Delete removes a document; deleteScope removes the whole scope")
    void delete_removesDocumentsAndScopes() throws IOException {
        final IngestionService ingestion = service(new Chunker(TOKEN_COUNTER, 50, 0));
        ingestion.ingest("tenant", "one", "Document one.", null);
        ingestion.ingest("tenant", "two", "Document two.", null);
        ingestion.ingest("other", "one", "Other scope.", null);

        ingestion.delete("tenant", "one");
        assertThat(everything("tenant")).extracting(IndexedChunk::documentId).containsExactly("two");

        ingestion.deleteScope("tenant");
        assertThat(everything("tenant")).isEmpty();
        assertThat(everything("other")).extracting(IndexedChunk::text).containsExactly("Other scope.");
    }

    @Test
    @DisplayName("Blank identifiers are rejected")
    void ingest_blankIds_throw() {
        final IngestionService ingestion = service(new Chunker(TOKEN_COUNTER, 50, 0));

        assertThatThrownBy(() -> ingestion.ingest(" ", "doc", "text", null))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ingestion.ingest("tenant", "", "text", null))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ingestion.delete("tenant", null))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("Index write failures surface as backend unavailable")
    void ingest_indexFailure_isBackendUnavailable() {
        final VectorIndexService broken = new VectorIndexService() {
            @Override
            public void upsert(final String ownerScope, final String documentId, final List<Chunk> chunks,
                               final List<float[]> vectors, final Map<String, String> metadata) throws IOException {
                throw new IOException("read-only file system");
            }

            @Override
            public void deleteDocument(final String ownerScope, final String documentId) throws IOException {
                throw new IOException("read-only file system");
            }

            @Override
            public void deleteScope(final String ownerScope) throws IOException {
                throw new IOException("read-only file system");
            }

            @Override
            public List<IndexedChunk> nearest(final NearestNeighborQuery query) {
                return List.of();
            }
        };
        final IngestionService ingestion =
                new IngestionService(extractor, new Chunker(TOKEN_COUNTER, 50, 0), embeddingClient, broken);

        assertThatThrownBy(() -> ingestion.ingest("tenant", "doc", "Some text.", null))
                .isInstanceOf(BackendUnavailableException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThatThrownBy(() -> ingestion.delete("tenant", "doc"))
                .isInstanceOf(BackendUnavailableException.class);
        assertThatThrownBy(() -> ingestion.deleteScope("tenant"))
                .isInstanceOf(BackendUnavailableException.class);
    }
}
