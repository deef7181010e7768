/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Built-in finite-difference stencils.
 * <p>
 * Provides forward, backward, central, and five-point difference formulas for
 * the derivative along a direction d with step h.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Registered by default under MethodKind.FORWARD, BACKWARD, CENTRAL, FIVE_POINT
 * MethodRegistry registry = MethodRegistry.defaults();
 *
 * // Or pick the stencils explicitly
 * MethodRegistry oneSided = MethodRegistry.builder()
 *     .register(FiniteDifference.FORWARD)
 *     .register(FiniteDifference.BACKWARD)
 *     .build();
 * }</pre>
 *
 * @see MethodRegistry
 */
public enum FiniteDifference implements Stencil {

    /**
     * Forward difference method.
     * <p>
     * g ≈ (f(x + h*d) - f(x)) / h
     * </p>
     * O(h) truncation error, one new evaluation per size since f(x) is shared.
     */
    FORWARD(MethodKind.FORWARD) {
        @Override
        public double[] estimate(Probe probe, double size) {
            double[] f0 = probe.center();
            double[] f1 = probe.offset(size);
            double[] g = new double[f0.length];
            for (int i = 0; i < g.length; i++) {
                g[i] = (f1[i] - f0[i]) / size;
            }
            return g;
        }
    },

    /**
     * Backward difference method.
     * <p>
     * g ≈ (f(x) - f(x - h*d)) / h
     * </p>
     * Same accuracy as forward difference. Paired with it, the mean of the two
     * equals the central difference.
     */
    BACKWARD(MethodKind.BACKWARD) {
        @Override
        public double[] estimate(Probe probe, double size) {
            double[] f0 = probe.center();
            double[] f1 = probe.offset(-size);
            double[] g = new double[f0.length];
            for (int i = 0; i < g.length; i++) {
                g[i] = (f0[i] - f1[i]) / size;
            }
            return g;
        }
    },

    /**
     * Central difference method.
     * <p>
     * g ≈ (f(x + h*d) - f(x - h*d)) / (2*h)
     * </p>
     * O(h²) accuracy, f(x) is not needed.
     */
    CENTRAL(MethodKind.CENTRAL) {
        @Override
        public double[] estimate(Probe probe, double size) {
            double[] f1 = probe.offset(size);
            double[] f2 = probe.offset(-size);
            double[] g = new double[f1.length];
            for (int i = 0; i < g.length; i++) {
                g[i] = (f1[i] - f2[i]) / (2.0 * size);
            }
            return g;
        }
    },

    /**
     * Five-point stencil method.
     * <p>
     * g ≈ (-f(x+2h*d) + 8f(x+h*d) - 8f(x-h*d) + f(x-2h*d)) / (12*h)
     * </p>
     * O(h⁴) accuracy, 4 function evaluations per size.
     */
    FIVE_POINT(MethodKind.FIVE_POINT) {
        @Override
        public double[] estimate(Probe probe, double size) {
            double[] f1 = probe.offset(2 * size);
            double[] f2 = probe.offset(size);
            double[] f3 = probe.offset(-size);
            double[] f4 = probe.offset(-2 * size);
            double[] g = new double[f1.length];
            for (int i = 0; i < g.length; i++) {
                g[i] = (-f1[i] + 8 * f2[i] - 8 * f3[i] + f4[i]) / (12.0 * size);
            }
            return g;
        }
    };

    private final MethodKind kind;

    FiniteDifference(MethodKind kind) {
        this.kind = kind;
    }

    /**
     * Gets the method kind this stencil is registered under by default.
     * @return Method kind
     */
    public MethodKind kind() {
        return kind;
    }
}
