package br.edu.ifba.hybridrag.utils;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Embedding conversions and similarity.
 * Vectors are stored as little-endian float32 BLOBs.
 */
public final class EmbeddingUtil {

    private EmbeddingUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static byte[] toBytes(@NotNull float[] embedding) {
        final ByteBuffer buffer = ByteBuffer.allocate(embedding.length * Float.BYTES);
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        for (float value : embedding) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    @NotNull
    public static float[] fromBytes(@NotNull byte[] bytes) {
        if (bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Embedding blob length must be a multiple of 4, got " + bytes.length);
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes);
        buffer.order(ByteOrder.LITTLE_ENDIAN);

        final float[] embedding = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = buffer.getFloat();
        }
        return embedding;
    }

    /**
     * Cosine similarity between two embeddings, in [-1, 1].
     * A zero vector has no direction; its similarity to anything is 0.
     *
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double cosineSimilarity(@NotNull float[] a, @NotNull float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Embeddings must have same dimensions: " + a.length + " vs " + b.length
            );
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
