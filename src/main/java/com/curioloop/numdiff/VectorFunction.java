/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.function.ToDoubleFunction;

/**
 * Functional interface for the function being differentiated.
 * <p>
 * The function maps a point of dimension n to a value of dimension m.
 * Scalar functions (m = 1) are adapted with {@link #scalar(ToDoubleFunction)}.
 * </p>
 * <p>
 * Implementations must treat the argument as read-only and should be
 * deterministic; the engine may call them several times with the same point.
 * </p>
 */
@FunctionalInterface
public interface VectorFunction {

    /**
     * Evaluates the function.
     *
     * @param x Point (read-only)
     * @return Function value, never null
     */
    double[] apply(double[] x);

    /**
     * Adapts a scalar function.
     * @param func Scalar function
     * @return Function returning a one-element vector
     */
    static VectorFunction scalar(ToDoubleFunction<double[]> func) {
        if (func == null) {
            throw new ConfigurationException("Function cannot be null");
        }
        return x -> new double[]{func.applyAsDouble(x)};
    }
}
