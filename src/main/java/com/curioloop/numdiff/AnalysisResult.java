/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.Arrays;

/**
 * A derived estimate produced by an {@link Analysis}.
 */
public final class AnalysisResult implements Estimate {

    private final String analysis;
    private final double[] value;
    private final double size;

    /**
     * Creates an analysis result.
     * @param analysis Id of the producing analysis
     * @param value Derived value
     * @param size Step size shared by the inputs
     */
    public AnalysisResult(String analysis, double[] value, double size) {
        if (analysis == null || value == null) {
            throw new IllegalArgumentException("Analysis id and value are required");
        }
        this.analysis = analysis;
        this.value = value.clone();
        this.size = size;
    }

    @Override
    public String getSource() {
        return analysis;
    }

    @Override
    public double[] getValue() {
        return value.clone();
    }

    @Override
    public double getSize() {
        return size;
    }

    @Override
    public String toString() {
        return "AnalysisResult{" +
                "analysis=" + analysis +
                ", size=" + size +
                ", value=" + Arrays.toString(value) +
                '}';
    }
}
