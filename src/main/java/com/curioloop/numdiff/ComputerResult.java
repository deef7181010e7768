/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.Arrays;

/**
 * A raw estimate produced by one stencil at one step size.
 */
public final class ComputerResult implements Estimate {

    private final MethodKind method;
    private final double[] value;
    private final double size;

    /**
     * Creates a computer result.
     * @param method Method that produced the estimate
     * @param value Estimated value
     * @param size Step size
     */
    public ComputerResult(MethodKind method, double[] value, double size) {
        if (method == null || value == null) {
            throw new IllegalArgumentException("Method and value are required");
        }
        this.method = method;
        this.value = value.clone();
        this.size = size;
    }

    /**
     * Gets the method that produced the estimate.
     * @return Method kind
     */
    public MethodKind getMethod() {
        return method;
    }

    @Override
    public String getSource() {
        return method.getId();
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
        return "ComputerResult{" +
                "method=" + method +
                ", size=" + size +
                ", value=" + Arrays.toString(value) +
                '}';
    }
}
