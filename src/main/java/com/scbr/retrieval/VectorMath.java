package com.scbr.retrieval;

/**
 * VectorMath - Cosine similarity for case embeddings
 */
public final class VectorMath {

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector is all zeros.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Vector dimensions must match: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** Similarity clamped to [0, 1] so it can be blended with normalized BM25. */
    public static double unitCosine(float[] a, float[] b) {
        return Math.max(0.0, Math.min(1.0, cosine(a, b)));
    }

    private VectorMath() {}
}
