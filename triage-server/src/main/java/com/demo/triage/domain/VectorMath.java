package com.demo.triage.domain;

/**
 * Vector helpers for embedding comparison.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]. A zero-length vector is treated as maximally dissimilar.
     */
    public static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + a.length + " vs " + b.length);
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
            return -1.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push |similarity| slightly past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * Incremental mean: {@code c + (e - c) / n}, where {@code n} counts {@code e}.
     */
    public static double[] runningMean(double[] centroid, double[] next, int count) {
        if (centroid.length != next.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + centroid.length + " vs " + next.length);
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        double[] result = new double[centroid.length];
        for (int i = 0; i < centroid.length; i++) {
            result[i] = centroid[i] + (next[i] - centroid[i]) / count;
        }
        return result;
    }

    public static double[] normalize(double[] vector) {
        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        if (norm == 0.0) {
            return vector.clone();
        }
        norm = Math.sqrt(norm);
        double[] result = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            result[i] = vector[i] / norm;
        }
        return result;
    }
}
