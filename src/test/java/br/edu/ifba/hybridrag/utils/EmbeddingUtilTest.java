package br.edu.ifba.hybridrag.utils;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EmbeddingUtilTest {

    @Test
    @DisplayName("blob encoding is little-endian float32")
    void testBlobIsLittleEndian() {
        byte[] bytes = EmbeddingUtil.toBytes(new float[] {1.0f});

        // 1.0f = 0x3F800000
        assertArrayEquals(new byte[] {0x00, 0x00, (byte) 0x80, 0x3F}, bytes);
        assertArrayEquals(new float[] {1.0f}, EmbeddingUtil.fromBytes(bytes));
    }

    @Test
    void testFromBytesRejectsTruncatedBlob() {
        assertThrows(IllegalArgumentException.class, () -> EmbeddingUtil.fromBytes(new byte[] {1, 2, 3}));
    }

    @Test
    void testCosineSimilarity() {
        assertEquals(1.0, EmbeddingUtil.cosineSimilarity(new float[] {1, 2, 3}, new float[] {2, 4, 6}), 1e-9);
        assertEquals(0.0, EmbeddingUtil.cosineSimilarity(new float[] {1, 0}, new float[] {0, 1}), 1e-9);
        assertEquals(-1.0, EmbeddingUtil.cosineSimilarity(new float[] {1, 0}, new float[] {-1, 0}), 1e-9);
    }

    @Test
    @DisplayName("zero vector has similarity 0 to everything")
    void testZeroVector() {
        assertEquals(0.0, EmbeddingUtil.cosineSimilarity(new float[] {0, 0}, new float[] {1, 1}));
    }

    @Test
    void testDimensionMismatch() {
        assertThrows(IllegalArgumentException.class,
            () -> EmbeddingUtil.cosineSimilarity(new float[] {1, 0}, new float[] {1, 0, 0}));
    }
}
