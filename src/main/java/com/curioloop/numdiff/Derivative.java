/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Result of a derivative request.
 * <p>
 * Holds one {@link DirectionalDerivative} per direction, in request order,
 * each with its full provenance. Directions that were not accepted occupy
 * NaN slots in {@link #getValue()} and {@link #getJacobian()}.
 * </p>
 */
public final class Derivative {

    private final List<DirectionalDerivative> directionals;
    private final int outputDimension;
    private final int evaluations;

    Derivative(List<DirectionalDerivative> directionals, int outputDimension, int evaluations) {
        this.directionals = Collections.unmodifiableList(new ArrayList<>(directionals));
        this.outputDimension = outputDimension;
        this.evaluations = evaluations;
    }

    /**
     * Gets the per-direction results.
     * @return Unmodifiable list in direction order
     */
    public List<DirectionalDerivative> getDirectionals() {
        return directionals;
    }

    /**
     * Gets the result for a direction.
     * @param id Direction id
     * @return Directional derivative
     * @throws IllegalArgumentException if no direction has this id
     */
    public DirectionalDerivative getDirectional(String id) {
        for (DirectionalDerivative d : directionals) {
            if (d.getDirection().getId().equals(id)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown direction '" + id + "'");
    }

    /**
     * Gets the derivative of a scalar function: one entry per direction,
     * NaN where the direction was not accepted. For the standard basis this
     * is the gradient.
     * @return Derivative vector
     * @throws IllegalStateException if the function is vector-valued
     */
    public double[] getValue() {
        if (outputDimension > 1) {
            throw new IllegalStateException("Function has " + outputDimension
                    + " outputs, use getJacobian()");
        }
        double[] value = new double[directionals.size()];
        for (int j = 0; j < value.length; j++) {
            double[] v = directionals.get(j).getValue();
            value[j] = v != null ? v[0] : Double.NaN;
        }
        return value;
    }

    /**
     * Gets the derivative as a matrix with one row per function output and
     * one column per direction. Columns of rejected directions are NaN.
     * @return Jacobian (outputs × directions)
     */
    public double[][] getJacobian() {
        int rows = Math.max(outputDimension, 1);
        double[][] jacobian = new double[rows][directionals.size()];
        for (int j = 0; j < directionals.size(); j++) {
            double[] v = directionals.get(j).getValue();
            for (int i = 0; i < rows; i++) {
                jacobian[i][j] = v != null ? v[i] : Double.NaN;
            }
        }
        return jacobian;
    }

    /**
     * Checks if every direction was accepted.
     * @return Logical AND of the directional success flags
     */
    public boolean isSuccess() {
        for (DirectionalDerivative d : directionals) {
            if (!d.isSuccess()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks if every combination produced an estimate.
     * @return false if any failure was recorded in partial mode
     */
    public boolean isComplete() {
        for (DirectionalDerivative d : directionals) {
            if (!d.isComplete()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Gets the number of outputs of the function.
     * @return Output dimension, 0 if the function was never evaluated successfully
     */
    public int getOutputDimension() {
        return outputDimension;
    }

    /**
     * Gets the number of function evaluations spent on the request.
     * @return Evaluation count
     */
    public int getEvaluations() {
        return evaluations;
    }

    /**
     * Builds the concise view: direction, success and value per row.
     * @return Rows in direction order
     */
    public List<DerivativeRow> conciseView() {
        List<DerivativeRow> rows = new ArrayList<>(directionals.size());
        for (DirectionalDerivative d : directionals) {
            rows.add(DerivativeRow.concise(d));
        }
        return rows;
    }

    /**
     * Builds the full view, which adds every raw and derived estimate.
     * @return Rows in direction order
     */
    public List<DerivativeRow> fullView() {
        List<DerivativeRow> rows = new ArrayList<>(directionals.size());
        for (DirectionalDerivative d : directionals) {
            rows.add(DerivativeRow.full(d));
        }
        return rows;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Derivative{success=").append(isSuccess())
                .append(", evaluations=").append(evaluations)
                .append(", jacobian=").append(Arrays.deepToString(getJacobian()));
        return sb.append('}').toString();
    }
}
