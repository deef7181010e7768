/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.Arrays;

/**
 * Thrown when the target function fails at a point required by a stencil.
 * <p>
 * When the function itself threw, the original exception is preserved as
 * the cause.
 * </p>
 */
public class EvaluationException extends DifferentiationException {

    private static final long serialVersionUID = 1L;

    private final double[] point;

    /**
     * Creates an evaluation exception for a malformed function value.
     * @param message Error message
     * @param point Point at which the function was evaluated
     */
    public EvaluationException(String message, double[] point) {
        super(message + " at " + Arrays.toString(point), ErrorKind.EVALUATION);
        this.point = point.clone();
    }

    /**
     * Creates an evaluation exception for a function that threw.
     * @param message Error message
     * @param point Point at which the function was evaluated
     * @param cause Exception thrown by the function
     */
    public EvaluationException(String message, double[] point, Throwable cause) {
        super(message + " at " + Arrays.toString(point), ErrorKind.EVALUATION, cause);
        this.point = point.clone();
    }

    /**
     * Gets the point at which evaluation failed.
     * @return Copy of the point
     */
    public double[] getPoint() {
        return point.clone();
    }
}
