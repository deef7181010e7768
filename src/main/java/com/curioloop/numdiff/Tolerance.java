/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Numeric closeness criterion.
 * <p>
 * Two values a and b are close when
 * </p>
 * <pre>
 *   |a - b| <= atol + rtol * max(|a|, |b|)
 * </pre>
 * The test is symmetric. NaN and infinite values are never close to anything.
 */
public final class Tolerance {

    private final double relative;
    private final double absolute;

    private Tolerance(Builder builder) {
        this.relative = builder.relative;
        this.absolute = builder.absolute;
    }

    /**
     * Creates a new builder for tolerances.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates the default tolerance (rtol = 1e-5, atol = 1e-8).
     * @return Default tolerance
     */
    public static Tolerance defaults() {
        return builder().build();
    }

    /**
     * Creates a tolerance.
     * @param relative Relative tolerance (rtol)
     * @param absolute Absolute tolerance (atol)
     * @return Tolerance
     */
    public static Tolerance of(double relative, double absolute) {
        return builder().relative(relative).absolute(absolute).build();
    }

    /**
     * Tests two scalars.
     * @param a First value
     * @param b Second value
     * @return true if close
     */
    public boolean isClose(double a, double b) {
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            return false;
        }
        return Math.abs(a - b) <= absolute + relative * Math.max(Math.abs(a), Math.abs(b));
    }

    /**
     * Tests two vectors element-wise.
     * @param a First vector
     * @param b Second vector
     * @return true if of equal length and every pair of entries is close
     */
    public boolean isClose(double[] a, double[] b) {
        if (a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (!isClose(a[i], b[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Gets the relative tolerance.
     * @return rtol
     */
    public double getRelative() {
        return relative;
    }

    /**
     * Gets the absolute tolerance.
     * @return atol
     */
    public double getAbsolute() {
        return absolute;
    }

    /**
     * Builder for Tolerance.
     */
    public static final class Builder {
        private double relative = 1e-5;
        private double absolute = 1e-8;

        private Builder() {}

        /**
         * Sets the relative tolerance.
         * @param value rtol (must be non-negative and finite)
         * @return This builder
         */
        public Builder relative(double value) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                throw new ConfigurationException("Relative tolerance must be non-negative and finite");
            }
            this.relative = value;
            return this;
        }

        /**
         * Sets the absolute tolerance.
         * @param value atol (must be non-negative and finite)
         * @return This builder
         */
        public Builder absolute(double value) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                throw new ConfigurationException("Absolute tolerance must be non-negative and finite");
            }
            this.absolute = value;
            return this;
        }

        /**
         * Builds the tolerance.
         * @return Tolerance
         */
        public Tolerance build() {
            return new Tolerance(this);
        }
    }

    @Override
    public String toString() {
        return "Tolerance{" +
                "relative=" + relative +
                ", absolute=" + absolute +
                '}';
    }
}
