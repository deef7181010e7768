/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Samples the target function along one direction from the evaluation point.
 * <p>
 * {@code offset(t)} evaluates f(x + t*d). {@link #center()} is f(x) and is
 * computed once per request no matter how many stencils ask for it.
 * Returned arrays are private copies and may be modified by the caller.
 * </p>
 */
public final class Probe {

    private final FunctionSampler sampler;
    private final Direction direction;

    Probe(FunctionSampler sampler, Direction direction) {
        this.sampler = sampler;
        this.direction = direction;
    }

    /**
     * Evaluates the function at the evaluation point.
     * @return f(x)
     * @throws EvaluationException if the function fails
     */
    public double[] center() {
        return sampler.base();
    }

    /**
     * Evaluates the function at a point displaced along the direction.
     * @param step Signed multiple of the direction vector
     * @return f(x + step*d)
     * @throws EvaluationException if the function fails
     */
    public double[] offset(double step) {
        return sampler.offset(direction, step);
    }

    /**
     * Gets the direction this probe is bound to.
     * @return Direction
     */
    public Direction getDirection() {
        return direction;
    }

    /** Length of f(x), evaluating it if nothing has been returned yet. */
    int outputDimension() {
        int m = sampler.getOutputDimension();
        return m > 0 ? m : sampler.base().length;
    }
}
