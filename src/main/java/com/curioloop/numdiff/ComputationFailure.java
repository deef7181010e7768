/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * A method and size combination that produced no estimate because the
 * function failed. Only recorded under {@link FailurePolicy#COLLECT_PARTIAL}.
 */
public final class ComputationFailure {

    private final MethodKind method;
    private final double size;
    private final EvaluationException cause;

    ComputationFailure(MethodKind method, double size, EvaluationException cause) {
        this.method = method;
        this.size = size;
        this.cause = cause;
    }

    /**
     * Gets the method that could not be evaluated.
     * @return Method kind
     */
    public MethodKind getMethod() {
        return method;
    }

    /**
     * Gets the step size that could not be evaluated.
     * @return Step size
     */
    public double getSize() {
        return size;
    }

    /**
     * Gets the evaluation error.
     * @return Cause
     */
    public EvaluationException getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "ComputationFailure{" +
                "method=" + method +
                ", size=" + size +
                ", cause=" + cause.getMessage() +
                '}';
    }
}
