/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands directions × sizes × methods and evaluates every combination.
 * <p>
 * Loop order is direction, then size, then method; this only fixes the order
 * of each direction's result list. Results are kept per direction so the
 * outer loop has no shared mutable state besides the function sampler.
 * </p>
 */
public final class ComputationOrchestrator {

    private static final Logger log = LogManager.getLogger(ComputationOrchestrator.class);

    private final DifferenceComputer computer;
    private final FailurePolicy failurePolicy;

    /**
     * Creates an orchestrator.
     * @param computer Difference computer
     * @param failurePolicy Failure policy
     */
    public ComputationOrchestrator(DifferenceComputer computer, FailurePolicy failurePolicy) {
        if (computer == null || failurePolicy == null) {
            throw new ConfigurationException("Difference computer and failure policy are required");
        }
        this.computer = computer;
        this.failurePolicy = failurePolicy;
    }

    /**
     * Runs every combination and returns the raw estimates per direction id.
     * <p>
     * Missing combinations under {@link FailurePolicy#COLLECT_PARTIAL} are only
     * visible through {@link #collect}; use it when failures matter.
     * </p>
     *
     * @param function Target function
     * @param point Evaluation point (not modified)
     * @param directions Directions, or null for the standard basis
     * @param sizes Step sizes
     * @param methods Method kinds
     * @return Estimates keyed by direction id, in direction order
     * @throws ConfigurationException if the request is invalid, before any evaluation
     * @throws EvaluationException under fail-fast, on the first failed evaluation
     */
    public Map<String, List<ComputerResult>> run(VectorFunction function, double[] point,
                                                 List<Direction> directions, List<Double> sizes,
                                                 Collection<MethodKind> methods) {
        FunctionSampler sampler = new FunctionSampler(function, point);
        List<Direction> resolved = Directions.resolve(directions, sampler.getDimension());
        Map<String, List<ComputerResult>> results = new LinkedHashMap<>();
        for (Computations c : collect(sampler, resolved, checkSizes(sizes), checkMethods(methods)).values()) {
            results.put(c.getDirection().getId(), c.getResults());
        }
        return Collections.unmodifiableMap(results);
    }

    /**
     * Runs every combination against a prepared sampler.
     * Arguments must already be validated.
     */
    Map<String, Computations> collect(FunctionSampler sampler, List<Direction> directions,
                                      List<Double> sizes, Set<MethodKind> methods) {
        Map<String, Computations> byDirection = new LinkedHashMap<>();
        for (Direction direction : directions) {
            Computations computations = new Computations(direction);
            Probe probe = sampler.along(direction);
            for (double size : sizes) {
                for (MethodKind method : methods) {
                    try {
                        computations.add(computer.compute(probe, size, method));
                    } catch (EvaluationException e) {
                        if (failurePolicy == FailurePolicy.FAIL_FAST) {
                            throw e;
                        }
                        log.warn("Skipping {} at size {} along '{}': {}",
                                method, size, direction.getId(), e.getMessage());
                        computations.fail(new ComputationFailure(method, size, e));
                    }
                }
            }
            byDirection.put(direction.getId(), computations.freeze());
        }
        return byDirection;
    }

    /**
     * Gets the failure policy.
     * @return Failure policy
     */
    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    /**
     * Validates step sizes: non-empty, positive, finite, distinct.
     */
    static List<Double> checkSizes(List<Double> sizes) {
        if (sizes == null || sizes.isEmpty()) {
            throw new ConfigurationException("At least one step size is required");
        }
        Set<Double> seen = new HashSet<>();
        for (Double size : sizes) {
            if (size == null) {
                throw new ConfigurationException("Step size cannot be null");
            }
            DifferenceComputer.checkSize(size);
            if (!seen.add(size)) {
                throw new ConfigurationException("Duplicate step size " + size);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(sizes));
    }

    /**
     * Validates method kinds against the registry and collapses duplicates.
     */
    Set<MethodKind> checkMethods(Collection<MethodKind> methods) {
        if (methods == null || methods.isEmpty()) {
            throw new ConfigurationException("At least one method is required");
        }
        computer.getRegistry().validate(methods);
        return Collections.unmodifiableSet(new LinkedHashSet<>(methods));
    }
}
