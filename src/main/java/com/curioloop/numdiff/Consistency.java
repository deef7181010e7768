/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Accepts a direction when independent estimates agree within a tolerance.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Partition the estimates by a grouping key, by default the step size.</li>
 *   <li>A group is consistent when every pair of its members is close
 *       (see {@link Tolerance}). A single finite member is consistent.</li>
 *   <li>Each consistent group is represented by the mean of its members.
 *       Inconsistent groups are left out.</li>
 *   <li>The direction succeeds when at least one group is consistent and every
 *       pair of representatives is close. The accepted value is the mean of
 *       the representatives.</li>
 * </ol>
 * Means and closeness are taken element-wise for vector-valued functions.
 * A direction whose groups disagree is rejected; no average over
 * disagreeing groups is ever reported.
 */
public final class Consistency implements SuccessEvaluator {

    private static final Logger log = LogManager.getLogger(Consistency.class);

    /** Groups estimates by step size */
    public static final Function<Estimate, Object> BY_SIZE = Estimate::getSize;

    /** Groups estimates by producing method or analysis, keeping method and analysis ids apart */
    public static final Function<Estimate, Object> BY_SOURCE =
            e -> (e instanceof AnalysisResult ? "analysis:" : "method:") + e.getSource();

    private final Tolerance tolerance;
    private final Function<Estimate, Object> groupingKey;

    /**
     * Creates a consistency policy.
     * @param tolerance Closeness criterion
     * @param groupingKey Key partitioning the estimates
     */
    public Consistency(Tolerance tolerance, Function<Estimate, Object> groupingKey) {
        if (tolerance == null || groupingKey == null) {
            throw new ConfigurationException("Tolerance and grouping key are required");
        }
        this.tolerance = tolerance;
        this.groupingKey = groupingKey;
    }

    /**
     * Creates a size-grouped policy with the default tolerance.
     * @return Consistency policy
     */
    public static Consistency defaults() {
        return of(Tolerance.defaults());
    }

    /**
     * Creates a size-grouped policy.
     * @param tolerance Closeness criterion
     * @return Consistency policy
     */
    public static Consistency of(Tolerance tolerance) {
        return new Consistency(tolerance, BY_SIZE);
    }

    /**
     * Creates a policy that groups by method or analysis instead of size.
     * @param tolerance Closeness criterion
     * @return Consistency policy
     */
    public static Consistency bySource(Tolerance tolerance) {
        return new Consistency(tolerance, BY_SOURCE);
    }

    @Override
    public Acceptance evaluate(Direction direction, List<Estimate> estimates) {
        if (estimates.isEmpty()) {
            return Acceptance.rejected(Outcome.NO_ESTIMATES);
        }

        Map<Object, List<double[]>> groups = new LinkedHashMap<>();
        for (Estimate e : estimates) {
            groups.computeIfAbsent(groupingKey.apply(e), k -> new ArrayList<>()).add(e.getValue());
        }

        List<double[]> representatives = new ArrayList<>();
        for (Map.Entry<Object, List<double[]>> group : groups.entrySet()) {
            if (allClose(group.getValue())) {
                representatives.add(mean(group.getValue()));
            } else {
                log.debug("Direction '{}': group {} is inconsistent", direction.getId(), group.getKey());
            }
        }

        if (representatives.isEmpty()) {
            return Acceptance.rejected(Outcome.NO_CONSISTENT_GROUP);
        }
        if (!allClose(representatives)) {
            return Acceptance.rejected(Outcome.GROUPS_DISAGREE);
        }
        return Acceptance.accepted(mean(representatives));
    }

    /**
     * Gets the tolerance.
     * @return Tolerance
     */
    public Tolerance getTolerance() {
        return tolerance;
    }

    // Non-finite members make a group inconsistent, even a single-member one
    private boolean allClose(List<double[]> values) {
        for (int i = 0; i < values.size(); i++) {
            for (int j = i; j < values.size(); j++) {
                if (!tolerance.isClose(values.get(i), values.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static double[] mean(List<double[]> values) {
        double[] sum = new double[values.get(0).length];
        for (double[] v : values) {
            for (int i = 0; i < sum.length; i++) {
                sum[i] += v[i];
            }
        }
        for (int i = 0; i < sum.length; i++) {
            sum[i] /= values.size();
        }
        return sum;
    }

    @Override
    public String toString() {
        return "Consistency{" +
                "tolerance=" + tolerance +
                ", groupingKey=" + (groupingKey == BY_SIZE ? "size" : groupingKey == BY_SOURCE ? "source" : "custom") +
                '}';
    }
}
