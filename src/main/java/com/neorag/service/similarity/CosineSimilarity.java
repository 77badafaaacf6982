package com.neorag.service.similarity;

/**
 * Cosine similarity between embeddings.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * dot(a, b) / (||a|| * ||b||), accumulated in double precision.
     *
     * @return similarity in [-1, 1]; 0.0 if either vector has zero norm
     * @throws IllegalArgumentException if the dimensions differ
     */
    public static double compute(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Embedding dimension mismatch: " + a.length + " vs " + b.length);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            double x = a[i];
            double y = b[i];
            dotProduct += x * y;
            normA += x * x;
            normB += y * y;
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
