/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.Arrays;

/**
 * A named vector along which the derivative is probed.
 * <p>
 * The magnitude of the vector is not normalized: probing along {@code 2*e_i}
 * reports twice the partial derivative.
 * </p>
 */
public final class Direction {

    private final String id;
    private final double[] vector;

    /**
     * Creates a direction.
     * @param id Identifier (non-blank)
     * @param vector Direction vector (non-empty, finite, not all zero)
     * @throws ConfigurationException if the id or vector is invalid
     */
    public Direction(String id, double[] vector) {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Direction id cannot be blank");
        }
        if (vector == null || vector.length == 0) {
            throw new ConfigurationException("Direction '" + id + "' must have a non-empty vector");
        }
        boolean nonZero = false;
        for (double v : vector) {
            if (!Double.isFinite(v)) {
                throw new ConfigurationException("Direction '" + id + "' has non-finite component");
            }
            nonZero |= v != 0.0;
        }
        if (!nonZero) {
            throw new ConfigurationException("Direction '" + id + "' is the zero vector");
        }
        this.id = id;
        this.vector = vector.clone();
    }

    /**
     * Creates the i-th standard basis vector of dimension n, identified by its index.
     * @param i Index of the non-zero component
     * @param n Dimension
     * @return Unit direction
     */
    public static Direction unit(int i, int n) {
        if (n <= 0 || i < 0 || i >= n) {
            throw new ConfigurationException("Invalid basis index " + i + " for dimension " + n);
        }
        double[] e = new double[n];
        e[i] = 1.0;
        return new Direction(String.valueOf(i), e);
    }

    /**
     * Gets the identifier.
     * @return Id
     */
    public String getId() {
        return id;
    }

    /**
     * Gets the direction vector.
     * @return Copy of the vector
     */
    public double[] getVector() {
        return vector.clone();
    }

    /**
     * Gets the dimension.
     * @return Vector length
     */
    public int getDimension() {
        return vector.length;
    }

    // Stencil hot path, no copy
    double component(int i) {
        return vector[i];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Direction)) return false;
        Direction that = (Direction) o;
        return id.equals(that.id) && Arrays.equals(vector, that.vector);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "Direction{" + id + "=" + Arrays.toString(vector) + '}';
    }
}
