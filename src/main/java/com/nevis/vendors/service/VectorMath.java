package com.nevis.vendors.service;

import com.nevis.vendors.exception.DimensionMismatchException;
import com.nevis.vendors.exception.InvalidVectorException;

public final class VectorMath {

    private VectorMath() {
    }

    public static double norm(float[] vector) {
        double sum = 0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    public static boolean isFinite(float[] vector) {
        for (float v : vector) {
            if (!Float.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    public static float[] normalize(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new InvalidVectorException("Cannot normalize an empty vector");
        }
        if (!isFinite(vector)) {
            throw new InvalidVectorException("Vector contains non-finite values");
        }
        double norm = norm(vector);
        if (norm == 0) {
            throw new InvalidVectorException("Cannot normalize a zero vector");
        }
        float[] result = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            result[i] = (float) (vector[i] / norm);
        }
        return result;
    }

    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double normA = norm(a);
        double normB = norm(b);
        if (normA == 0 || normB == 0) {
            throw new InvalidVectorException("Cosine similarity is undefined for a zero vector");
        }
        return cosine(a, normA, b, normB);
    }

    static double cosine(float[] a, double normA, float[] b, double normB) {
        double dot = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        double score = dot / (normA * normB);
        return Math.max(-1.0, Math.min(1.0, score));
    }
}
