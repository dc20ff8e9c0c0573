package com.nevis.vision.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Immutable fixed-length vector. Every embedding the gateway produces itself is unit length,
 * except the all-zero vector returned for degenerate input.
 */
public final class Embedding {

    private final float[] vector;

    private Embedding(float[] vector) {
        this.vector = vector;
    }

    @JsonCreator
    public static Embedding of(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Embedding vector cannot be empty");
        }
        return new Embedding(vector.clone());
    }

    /**
     * Scales the vector to unit length. A zero vector is returned unchanged.
     */
    public static Embedding normalized(double[] raw) {
        if (raw == null || raw.length == 0) {
            throw new IllegalArgumentException("Embedding vector cannot be empty");
        }
        double sumOfSquares = 0;
        for (double value : raw) {
            sumOfSquares += value * value;
        }
        double magnitude = Math.sqrt(sumOfSquares);

        float[] result = new float[raw.length];
        for (int i = 0; i < raw.length; i++) {
            result[i] = magnitude == 0 ? (float) raw[i] : (float) (raw[i] / magnitude);
        }
        return new Embedding(result);
    }

    public static Embedding normalized(float[] raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Embedding vector cannot be empty");
        }
        double[] widened = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            widened[i] = raw[i];
        }
        return normalized(widened);
    }

    @JsonValue
    public float[] vector() {
        return vector.clone();
    }

    public int dimension() {
        return vector.length;
    }

    public double norm() {
        double sumOfSquares = 0;
        for (float value : vector) {
            sumOfSquares += (double) value * value;
        }
        return Math.sqrt(sumOfSquares);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Embedding other && Arrays.equals(vector, other.vector);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "Embedding[dimension=" + vector.length + "]";
    }
}
