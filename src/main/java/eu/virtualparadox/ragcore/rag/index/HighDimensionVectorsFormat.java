package eu.virtualparadox.ragcore.rag.index;

import org.apache.lucene.codecs.Codec;
import org.apache.lucene.codecs.KnnVectorsFormat;
import org.apache.lucene.codecs.KnnVectorsReader;
import org.apache.lucene.codecs.KnnVectorsWriter;
import org.apache.lucene.codecs.lucene912.Lucene912Codec;
import org.apache.lucene.codecs.lucene99.Lucene99HnswVectorsFormat;
import org.apache.lucene.index.SegmentReadState;
import org.apache.lucene.index.SegmentWriteState;

import java.io.IOException;

/**
 * HNSW vector format that accepts up to {@value #MAX_DIMENSIONS} dimensions.
 * <p>
 * Lucene caps vector fields at 1024 dimensions by default, below what hosted embedding models
 * return (1536 for {@code text-embedding-3-small}, 3072 for {@code text-embedding-3-large}).
 * The on-disk format is the stock {@code Lucene99HnswVectorsFormat}, and the format is
 * registered under the same name, so segments written with it are read back by the default
 * codec without any SPI registration.
 * </p>
 */
public final class HighDimensionVectorsFormat extends KnnVectorsFormat {

    public static final int MAX_DIMENSIONS = 4096;

    private final KnnVectorsFormat delegate = new Lucene99HnswVectorsFormat();

    public HighDimensionVectorsFormat() {
        super("Lucene99HnswVectorsFormat");
    }

    /**
     * @return the default codec with this format for every vector field
     */
    public static Codec codec() {
        final KnnVectorsFormat format = new HighDimensionVectorsFormat();
        return new Lucene912Codec() {
            @Override
            public KnnVectorsFormat getKnnVectorsFormatForField(final String field) {
                return format;
            }
        };
    }

    @Override
    public KnnVectorsWriter fieldsWriter(final SegmentWriteState state) throws IOException {
        return delegate.fieldsWriter(state);
    }

    @Override
    public KnnVectorsReader fieldsReader(final SegmentReadState state) throws IOException {
        return delegate.fieldsReader(state);
    }

    @Override
    public int getMaxDimensions(final String fieldName) {
        return MAX_DIMENSIONS;
    }

    @Override
    public String toString() {
        return "HighDimensionVectorsFormat(" + delegate + ", maxDimensions=" + MAX_DIMENSIONS + ")";
    }
}
