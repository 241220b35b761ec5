package com.insightpulse.kgengine.util;

/**
 * Vector helpers for cosine similarity. Stored vectors are unit length, so cosine is a dot product.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double norm(float[] vector) {
        double sum = 0.0;
        for (float component : vector) {
            sum += (double) component * component;
        }
        return Math.sqrt(sum);
    }

    /**
     * @return a new unit-length copy of {@code vector}; the input must not be a zero vector
     */
    public static float[] normalize(float[] vector) {
        double norm = norm(vector);
        float[] unit = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            unit[i] = (float) (vector[i] / norm);
        }
        return unit;
    }

    public static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }
}
