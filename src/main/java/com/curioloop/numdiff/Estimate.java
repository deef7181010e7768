/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * One estimate of a directional derivative.
 * <p>
 * Raw {@link ComputerResult}s and derived {@link AnalysisResult}s share this
 * shape so a {@link SuccessEvaluator} can pool them uniformly.
 * </p>
 */
public interface Estimate {

    /**
     * Gets the id of whatever produced the estimate: a method id for raw
     * results, an analysis id for derived ones.
     * @return Source id
     */
    String getSource();

    /**
     * Gets the estimated directional derivative, one entry per function output.
     * @return Copy of the value
     */
    double[] getValue();

    /**
     * Gets the step size the estimate was computed at.
     * @return Step size
     */
    double getSize();
}
