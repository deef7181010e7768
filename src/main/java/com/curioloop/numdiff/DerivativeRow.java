/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One row of a tabular view of a {@link Derivative}.
 * <p>
 * Concise rows carry direction, success and value; full rows additionally
 * carry the raw and derived estimates for debugging.
 * </p>
 */
public final class DerivativeRow {

    private final String direction;
    private final boolean success;
    private final double[] value;
    private final List<ComputerResult> computerResults;
    private final List<AnalysisResult> analysisResults;

    private DerivativeRow(String direction, boolean success, double[] value,
                          List<ComputerResult> computerResults,
                          List<AnalysisResult> analysisResults) {
        this.direction = direction;
        this.success = success;
        this.value = value;
        this.computerResults = computerResults;
        this.analysisResults = analysisResults;
    }

    static DerivativeRow concise(DirectionalDerivative d) {
        return new DerivativeRow(d.getDirection().getId(), d.isSuccess(), d.getValue(),
                Collections.emptyList(), Collections.emptyList());
    }

    static DerivativeRow full(DirectionalDerivative d) {
        return new DerivativeRow(d.getDirection().getId(), d.isSuccess(), d.getValue(),
                d.getComputerResults(), d.getAnalysisResults());
    }

    /**
     * Gets the direction id.
     * @return Direction id
     */
    public String getDirection() {
        return direction;
    }

    /**
     * Checks if the direction was accepted.
     * @return Success flag
     */
    public boolean isSuccess() {
        return success;
    }

    /**
     * Gets the accepted value.
     * @return Copy of the value, or null if not accepted
     */
    public double[] getValue() {
        return value != null ? value.clone() : null;
    }

    /**
     * Gets the raw estimates. Empty in concise rows.
     * @return Unmodifiable list
     */
    public List<ComputerResult> getComputerResults() {
        return computerResults;
    }

    /**
     * Gets the derived estimates. Empty in concise rows.
     * @return Unmodifiable list
     */
    public List<AnalysisResult> getAnalysisResults() {
        return analysisResults;
    }

    @Override
    public String toString() {
        return direction + " | " + success + " | " + Arrays.toString(value)
                + (computerResults.isEmpty() && analysisResults.isEmpty()
                        ? "" : " | " + computerResults + " | " + analysisResults);
    }
}
