/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Per-request access to the target function.
 * <p>
 * Owns a private copy of the point, caches f(x) (which every direction, size
 * and one-sided method shares), checks every returned value and counts
 * evaluations. A failed f(x) is cached as well so that partial mode does not
 * call the function again at the same point.
 * </p>
 * <p>
 * This class is <b>not thread-safe</b>; one instance serves one request.
 * </p>
 */
final class FunctionSampler {

    private final VectorFunction function;
    private final double[] point;

    private double[] base;
    private EvaluationException baseFailure;
    private int outputDimension = -1;
    private int evaluations;

    FunctionSampler(VectorFunction function, double[] point) {
        if (function == null) {
            throw new ConfigurationException("Function cannot be null");
        }
        if (point == null || point.length == 0) {
            throw new ConfigurationException("Point cannot be null or empty");
        }
        for (double v : point) {
            if (!Double.isFinite(v)) {
                throw new ConfigurationException("Point has non-finite component");
            }
        }
        this.function = function;
        this.point = point.clone();
    }

    /**
     * Creates a probe along the given direction.
     * @param direction Direction (dimension already validated)
     * @return Probe sharing this sampler's cache
     */
    Probe along(Direction direction) {
        return new Probe(this, direction);
    }

    /**
     * Evaluates f(x), at most once.
     */
    double[] base() {
        if (baseFailure != null) {
            throw baseFailure;
        }
        if (base == null) {
            try {
                base = evaluate(point.clone());
            } catch (EvaluationException e) {
                baseFailure = e;
                throw e;
            }
        }
        return base.clone();
    }

    /**
     * Evaluates f(x + step*d). The shared point is never written.
     */
    double[] offset(Direction direction, double step) {
        if (step == 0.0) {
            return base();
        }
        double[] x = new double[point.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = point[i] + step * direction.component(i);
        }
        return evaluate(x);
    }

    int getDimension() {
        return point.length;
    }

    int getEvaluations() {
        return evaluations;
    }

    /** 0 until the function has returned a valid value. */
    int getOutputDimension() {
        return Math.max(outputDimension, 0);
    }

    private double[] evaluate(double[] x) {
        evaluations++;
        double[] fx;
        try {
            fx = function.apply(x.clone());
        } catch (EvaluationException e) {
            // nested request
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Function threw " + e.getClass().getSimpleName(), x, e);
        }
        if (fx == null) {
            throw new EvaluationException("Function returned null", x);
        }
        if (outputDimension < 0) {
            if (fx.length == 0) {
                throw new EvaluationException("Function returned an empty vector", x);
            }
            outputDimension = fx.length;
        } else if (fx.length != outputDimension) {
            throw new EvaluationException("Function returned " + fx.length
                    + " values, expected " + outputDimension, x);
        }
        for (double v : fx) {
            if (!Double.isFinite(v)) {
                throw new EvaluationException("Function returned non-finite value " + v, x);
            }
        }
        return fx.clone();
    }
}
