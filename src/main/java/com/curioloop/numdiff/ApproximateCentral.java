/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthesizes a central-difference estimate from a forward and a backward one.
 * <p>
 * For each step size that has both a {@link MethodKind#FORWARD} and a
 * {@link MethodKind#BACKWARD} result, emits their mean:
 * </p>
 * <pre>
 *   ((f(x+h*d) - f(x))/h + (f(x) - f(x-h*d))/h) / 2 = (f(x+h*d) - f(x-h*d)) / (2*h)
 * </pre>
 * Sizes missing either side emit nothing. Sizes are visited in the order
 * they first appear.
 */
public final class ApproximateCentral implements Analysis {

    /** Id stamped on results */
    public static final String ID = "approximate_central";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<AnalysisResult> derive(List<ComputerResult> results) {
        Map<Double, ComputerResult[]> bySize = new LinkedHashMap<>();
        for (ComputerResult r : results) {
            int slot;
            if (MethodKind.FORWARD.equals(r.getMethod())) {
                slot = 0;
            } else if (MethodKind.BACKWARD.equals(r.getMethod())) {
                slot = 1;
            } else {
                continue;
            }
            ComputerResult[] pair = bySize.computeIfAbsent(r.getSize(), k -> new ComputerResult[2]);
            if (pair[slot] == null) {
                pair[slot] = r;
            }
        }

        List<AnalysisResult> derived = new ArrayList<>();
        for (Map.Entry<Double, ComputerResult[]> e : bySize.entrySet()) {
            ComputerResult[] pair = e.getValue();
            if (pair[0] == null || pair[1] == null) {
                continue;
            }
            double[] forward = pair[0].getValue();
            double[] backward = pair[1].getValue();
            double[] mean = new double[forward.length];
            for (int i = 0; i < mean.length; i++) {
                mean[i] = (forward[i] + backward[i]) / 2.0;
            }
            derived.add(new AnalysisResult(ID, mean, e.getKey()));
        }
        return derived;
    }

    @Override
    public String toString() {
        return ID;
    }
}
