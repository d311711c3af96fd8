package eu.virtualparadox.ragcore.application.config;

import eu.virtualparadox.ragcore.rag.index.HighDimensionVectorsFormat;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates and manages Lucene resources (Directory, IndexWriter, SearcherManager).
 * <p>Resources are opened against the on-disk index under {@code ragcore.index}, or an in-memory
 * directory when it is unset, and closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;

    /**
     * Provides the Lucene directory bound to the configured index path.
     *
     * @param props system properties (resolved from application.properties)
     * @return opened {@link Directory}
     * @throws IOException if the path cannot be created or opened
     */
    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path indexPath = props.getIndex();
        if (indexPath == null) {
            log.info("No index path configured, using an in-memory Lucene index");
            this.directory = new ByteBuffersDirectory();
        } else {
            Files.createDirectories(indexPath);
            log.info("Opening Lucene index at {}", indexPath.toAbsolutePath());
            this.directory = FSDirectory.open(indexPath);
        }
        return this.directory;
    }

    /**
     * Provides the Lucene IndexWriter configured for create-or-append mode with a codec
     * accepting high-dimensional vectors.
     *
     * @param dir Lucene directory
     * @return {@link IndexWriter}
     * @throws IOException on writer creation error
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir) throws IOException {
        this.indexWriter = new IndexWriter(dir, indexWriterConfig());
        return this.indexWriter;
    }

    /**
     * Provides a {@link SearcherManager} for near-real-time search.
     *
     * @param writer index writer
     * @return {@link SearcherManager}
     * @throws IOException on failure
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    /**
     * Writer settings shared by the application context and tests.
     */
    public static IndexWriterConfig indexWriterConfig() {
        return new IndexWriterConfig()
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)
                .setCodec(HighDimensionVectorsFormat.codec());
    }

    /**
     * Ensures Lucene resources are closed cleanly on shutdown.
     */
    @PreDestroy
    public void close() {
        try { if (searcherManager != null) searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { if (indexWriter != null) indexWriter.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { if (directory != null) directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}
