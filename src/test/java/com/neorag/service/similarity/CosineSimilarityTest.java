package com.neorag.service.similarity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CosineSimilarity.
 */
class CosineSimilarityTest {

    @Test
    void testSelfSimilarityIsOne() {
        float[] v = {0.3f, -1.2f, 4.5f, 0.01f};
        assertEquals(1.0, CosineSimilarity.compute(v, v), 1e-9);
    }

    @Test
    void testSymmetric() {
        float[] a = {1f, 2f, 3f};
        float[] b = {-2f, 0.5f, 7f};
        assertEquals(CosineSimilarity.compute(a, b), CosineSimilarity.compute(b, a), 1e-15);
    }

    @Test
    void testOrthogonalAndOpposite() {
        assertEquals(0.0, CosineSimilarity.compute(new float[]{1f, 0f}, new float[]{0f, 1f}), 1e-12);
        assertEquals(-1.0, CosineSimilarity.compute(new float[]{1f, 2f}, new float[]{-1f, -2f}), 1e-9);
    }

    @Test
    void testZeroVectorGivesZero() {
        assertEquals(0.0, CosineSimilarity.compute(new float[]{0f, 0f, 0f}, new float[]{1f, 2f, 3f}));
    }

    @Test
    void testDimensionMismatchRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CosineSimilarity.compute(new float[]{1f, 2f}, new float[]{1f, 2f, 3f}));
    }
}
