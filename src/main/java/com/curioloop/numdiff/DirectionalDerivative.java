/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The derivative along one direction, with every estimate that led to it.
 */
public final class DirectionalDerivative {

    private final Direction direction;
    private final Acceptance acceptance;
    private final List<ComputerResult> computerResults;
    private final List<AnalysisResult> analysisResults;
    private final List<ComputationFailure> failures;

    DirectionalDerivative(Direction direction, Acceptance acceptance,
                          List<ComputerResult> computerResults,
                          List<AnalysisResult> analysisResults,
                          List<ComputationFailure> failures) {
        this.direction = direction;
        this.acceptance = acceptance;
        this.computerResults = Collections.unmodifiableList(new ArrayList<>(computerResults));
        this.analysisResults = Collections.unmodifiableList(new ArrayList<>(analysisResults));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    /**
     * Gets the direction.
     * @return Direction
     */
    public Direction getDirection() {
        return direction;
    }

    /**
     * Checks if the estimates were accepted.
     * @return true on success
     */
    public boolean isSuccess() {
        return acceptance.isSuccess();
    }

    /**
     * Gets the reason for success or failure.
     * @return Outcome
     */
    public Outcome getOutcome() {
        return acceptance.getOutcome();
    }

    /**
     * Gets the accepted value.
     * @return Copy of the value, or null if not accepted
     */
    public double[] getValue() {
        return acceptance.getValue();
    }

    /**
     * Checks if every method and size combination produced an estimate.
     * @return false if failures were recorded in partial mode
     */
    public boolean isComplete() {
        return failures.isEmpty();
    }

    /**
     * Gets the raw estimates in computation order.
     * @return Unmodifiable list
     */
    public List<ComputerResult> getComputerResults() {
        return computerResults;
    }

    /**
     * Gets the derived estimates in analysis order.
     * @return Unmodifiable list
     */
    public List<AnalysisResult> getAnalysisResults() {
        return analysisResults;
    }

    /**
     * Gets the combinations that failed in partial mode.
     * @return Unmodifiable list
     */
    public List<ComputationFailure> getFailures() {
        return failures;
    }

    @Override
    public String toString() {
        return "DirectionalDerivative{" +
                "direction=" + direction.getId() +
                ", acceptance=" + acceptance +
                ", computerResults=" + computerResults.size() +
                ", analysisResults=" + analysisResults.size() +
                ", failures=" + failures.size() +
                '}';
    }
}
