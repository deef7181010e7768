/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Evaluates one finite-difference estimate.
 * <p>
 * Stateless apart from the read-only registry; safe to share.
 * </p>
 */
public final class DifferenceComputer {

    private final MethodRegistry registry;

    /**
     * Creates a computer backed by the given registry.
     * @param registry Method registry
     */
    public DifferenceComputer(MethodRegistry registry) {
        if (registry == null) {
            throw new ConfigurationException("Method registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * Computes one estimate of the directional derivative from scratch.
     * <p>
     * The point is copied; f(x) is evaluated for this call only. Use
     * {@link NumericalDerivative} to share f(x) across many estimates.
     * </p>
     *
     * @param function Target function
     * @param point Evaluation point (not modified)
     * @param direction Direction with the point's dimension
     * @param size Positive step size
     * @param method Registered method kind
     * @return Raw estimate tagged with method and size
     * @throws ConfigurationException if the arguments are invalid
     * @throws EvaluationException if the function fails at a required point
     * @throws IllegalStateException if the stencil output does not have one value per function output
     */
    public ComputerResult compute(VectorFunction function, double[] point, Direction direction,
                                  double size, MethodKind method) {
        Stencil stencil = registry.stencil(method);
        checkSize(size);
        FunctionSampler sampler = new FunctionSampler(function, point);
        if (direction == null || direction.getDimension() != sampler.getDimension()) {
            throw new ConfigurationException("Direction must have dimension " + sampler.getDimension());
        }
        return estimate(stencil, sampler.along(direction), size, method);
    }

    /**
     * Computes one estimate through an existing probe.
     * @param probe Probe bound to the point and direction
     * @param size Step size (already validated)
     * @param method Registered method kind
     * @return Raw estimate tagged with method and size
     * @throws EvaluationException if the function fails at a required point
     * @throws IllegalStateException if the stencil output does not have one value per function output
     */
    public ComputerResult compute(Probe probe, double size, MethodKind method) {
        return estimate(registry.stencil(method), probe, size, method);
    }

    /**
     * Gets the registry used to resolve methods.
     * @return Method registry
     */
    public MethodRegistry getRegistry() {
        return registry;
    }

    static void checkSize(double size) {
        if (!(size > 0) || Double.isInfinite(size)) {
            throw new ConfigurationException("Step size must be positive and finite, got " + size);
        }
    }

    private static ComputerResult estimate(Stencil stencil, Probe probe, double size, MethodKind method) {
        double[] value = stencil.estimate(probe, size);
        if (value == null) {
            throw new IllegalStateException("Stencil '" + method + "' returned null");
        }
        int expected = probe.outputDimension();
        if (value.length != expected) {
            throw new IllegalStateException("Stencil '" + method + "' returned " + value.length
                    + " values, expected " + expected);
        }
        return new ComputerResult(method, value, size);
    }
}
