package eu.virtualparadox.ragcore.rag.embed.provider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Offline {@link EmbeddingProvider} producing deterministic unit vectors from the SHA-256 of
 * each text. Identical texts map to identical vectors; there is no semantic similarity.
 * Used for local runs without an API key and in tests.
 */
public final class HashEmbeddingProvider implements EmbeddingProvider {

    private final int dimensions;

    public HashEmbeddingProvider(final int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public CompletableFuture<List<float[]>> embed(final List<String> texts, final String model) {
        final List<float[]> vectors = new ArrayList<>(texts.size());
        for (final String text : texts) {
            vectors.add(vectorOf(text));
        }
        return CompletableFuture.completedFuture(vectors);
    }

    @Override
    public String name() {
        return "hash";
    }

    float[] vectorOf(final String text) {
        final byte[] digest = sha256(text);
        final float[] vector = new float[dimensions];

        // cycle through the digest bytes, mapped to [-1, 1]
        double norm = 0.0;
        for (int i = 0; i < dimensions; i++) {
            final float value = (float) (((digest[i % digest.length] & 0xFF) / 127.5) - 1.0);
            vector[i] = value;
            norm += value * value;
        }

        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < dimensions; i++) {
                vector[i] /= (float) norm;
            }
        }
        return vector;
    }

    private static byte[] sha256(final String text) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
