/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * A finite-difference formula for the directional derivative.
 * <p>
 * A stencil samples the function through a {@link Probe}, which is already
 * bound to the point and direction, and combines the samples for one step
 * size. Stencils must be stateless.
 * </p>
 *
 * <pre>{@code
 * // Second-order one-sided formula
 * Stencil threePoint = (probe, h) -> {
 *     double[] f0 = probe.center();
 *     double[] f1 = probe.offset(h);
 *     double[] f2 = probe.offset(2 * h);
 *     double[] g = new double[f0.length];
 *     for (int i = 0; i < g.length; i++) {
 *         g[i] = (-3 * f0[i] + 4 * f1[i] - f2[i]) / (2 * h);
 *     }
 *     return g;
 * };
 * }</pre>
 *
 * @see MethodRegistry
 */
@FunctionalInterface
public interface Stencil {

    /**
     * Computes one estimate of the directional derivative.
     * @param probe Function sampler bound to the point and direction
     * @param size Step size (positive)
     * @return Estimate with one entry per function output
     * @throws EvaluationException if a required function evaluation fails
     */
    double[] estimate(Probe probe, double size);
}
