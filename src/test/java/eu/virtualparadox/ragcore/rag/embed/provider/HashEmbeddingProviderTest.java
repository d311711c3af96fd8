package eu.virtualparadox.ragcore.rag.embed.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;

class HashEmbeddingProviderTest {

    private final HashEmbeddingProvider provider = new HashEmbeddingProvider(64);

    @Test
    @DisplayName("Vectors are unit length and of the configured dimension")
    void embed_unitVectors() {
        final List<float[]> vectors = provider.embed(List.of("alpha", "beta"), "ignored").join();

        assertThat(vectors).hasSize(2);
        for (final float[] vector : vectors) {
            assertThat(vector).hasSize(64);
            double norm = 0;
            for (final float v : vector) {
                norm += v * v;
            }
            assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
        }
    }

    @Test
    @DisplayName("Identical texts give identical vectors, different texts different ones")
    void embed_isDeterministic() {
        assertArrayEquals(provider.vectorOf("same"), new HashEmbeddingProvider(64).vectorOf("same"));
        assertThat(provider.vectorOf("same")).isNotEqualTo(provider.vectorOf("other"));
    }

    @Test
    @DisplayName("Dimension must be positive")
    void constructor_nonPositiveDimensions_throws() {
        assertThatThrownBy(() -> new HashEmbeddingProvider(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
