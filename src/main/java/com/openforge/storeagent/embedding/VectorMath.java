package com.openforge.storeagent.embedding;

final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]. A zero vector has no direction and scores 0
     * against everything.
     */
    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector length mismatch: %d vs %d".formatted(a.length, b.length));
        }
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0;
        double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push identical vectors a hair past 1
        return Math.max(-1.0, Math.min(1.0, cos));
    }
}
