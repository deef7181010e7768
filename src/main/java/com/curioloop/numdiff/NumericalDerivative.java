/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Finite-difference derivative with built-in cross-validation.
 * <p>
 * For every direction, every configured method is evaluated at every
 * configured step size. Configured {@link Analysis analyses} derive further
 * estimates, and the {@link SuccessEvaluator} decides from all of them
 * whether the direction can be trusted. No analytic derivative is needed:
 * estimates are only checked against each other.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are immutable and can be shared. Each call to
 * {@link #differentiate} keeps its own f(x) cache and evaluation counter.
 * The target function is called from the calling thread only.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * // Gradient with default Consistency check
 * Derivative d = NumericalDerivative.estimate(
 *     x -> x[0]*x[0] + x[1]*x[1],
 *     new double[]{1, 2},
 *     new double[]{1e-6, 1e-4},
 *     MethodKind.FORWARD, MethodKind.BACKWARD);
 *
 * // Full control with builder
 * NumericalDerivative nd = NumericalDerivative.builder()
 *     .sizes(1e-10, 1e-5)
 *     .methods(MethodKind.FORWARD, MethodKind.BACKWARD)
 *     .analyses(new ApproximateCentral())
 *     .successEvaluator(Consistency.of(Tolerance.of(1e-2, 1e-15)))
 *     .build();
 *
 * Derivative d = nd.gradient(rosenbrock, new double[]{1, 0, 0});
 * if (d.isSuccess()) {
 *     double[] g = d.getValue();
 * }
 * }</pre>
 */
public final class NumericalDerivative {

    private static final Logger log = LogManager.getLogger(NumericalDerivative.class);

    private final List<Double> sizes;
    private final Set<MethodKind> methods;
    private final List<Direction> directions;
    private final List<Analysis> analyses;
    private final SuccessEvaluator successEvaluator;
    private final ComputationOrchestrator orchestrator;

    private NumericalDerivative(Builder builder, List<Double> sizes, Set<MethodKind> methods,
                                ComputationOrchestrator orchestrator) {
        this.sizes = sizes;
        this.methods = methods;
        this.directions = builder.directions != null
                ? Collections.unmodifiableList(new ArrayList<>(builder.directions)) : null;
        this.analyses = Collections.unmodifiableList(new ArrayList<>(builder.analyses));
        this.successEvaluator = builder.successEvaluator;
        this.orchestrator = orchestrator;
    }

    /**
     * Creates a new builder.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    // ==================== Convenience static methods ====================

    /**
     * Estimates the gradient of a scalar function along the standard basis,
     * accepted by {@link Consistency#defaults()}.
     *
     * @param function Scalar function
     * @param point Evaluation point
     * @param sizes Step sizes
     * @param methods Method kinds
     * @return Derivative
     */
    public static Derivative estimate(ToDoubleFunction<double[]> function, double[] point,
                                      double[] sizes, MethodKind... methods) {
        return builder()
                .sizes(sizes)
                .methods(methods)
                .build()
                .gradient(function, point);
    }

    /**
     * Differentiates a scalar function.
     * @param function Scalar function
     * @param point Evaluation point (not modified)
     * @return Derivative with one value per direction
     * @throws ConfigurationException if the request is invalid, before any evaluation
     * @throws EvaluationException if the function fails and the policy is fail-fast
     */
    public Derivative gradient(ToDoubleFunction<double[]> function, double[] point) {
        return differentiate(VectorFunction.scalar(function), point);
    }

    /**
     * Differentiates a vector-valued function.
     * @param function Target function
     * @param point Evaluation point (not modified)
     * @return Derivative with one Jacobian column per direction
     * @throws ConfigurationException if the request is invalid, before any evaluation
     * @throws EvaluationException if the function fails and the policy is fail-fast
     */
    public Derivative differentiate(VectorFunction function, double[] point) {
        FunctionSampler sampler = new FunctionSampler(function, point);
        List<Direction> resolved = Directions.resolve(directions, sampler.getDimension());
        if (log.isDebugEnabled()) {
            log.debug("Differentiating at {} along {} directions, sizes {}, methods {}",
                    Arrays.toString(point), resolved.size(), sizes, methods);
        }

        Map<String, Computations> computed = orchestrator.collect(sampler, resolved, sizes, methods);

        List<DirectionalDerivative> directionals = new ArrayList<>(resolved.size());
        for (Computations c : computed.values()) {
            directionals.add(assemble(c, sampler.getOutputDimension()));
        }

        Derivative derivative = new Derivative(directionals,
                sampler.getOutputDimension(), sampler.getEvaluations());
        log.debug("Derivative done: success={}, complete={}, evaluations={}",
                derivative.isSuccess(), derivative.isComplete(), derivative.getEvaluations());
        return derivative;
    }

    private DirectionalDerivative assemble(Computations computations, int outputDimension) {
        List<ComputerResult> raw = computations.getResults();
        List<AnalysisResult> derived = new ArrayList<>();
        for (Analysis analysis : analyses) {
            List<AnalysisResult> out = analysis.derive(raw);
            if (out == null) {
                throw new IllegalStateException("Analysis '" + analysis.id() + "' returned null");
            }
            for (AnalysisResult r : out) {
                if (r == null || r.getValue().length != outputDimension) {
                    throw new IllegalStateException("Analysis '" + analysis.id()
                            + "' returned a result that does not match " + outputDimension + " outputs");
                }
            }
            derived.addAll(out);
        }

        List<Estimate> pool = new ArrayList<>(raw.size() + derived.size());
        pool.addAll(raw);
        pool.addAll(derived);

        Direction direction = computations.getDirection();
        Acceptance acceptance = successEvaluator.evaluate(direction, Collections.unmodifiableList(pool));
        if (acceptance == null) {
            throw new IllegalStateException("Success evaluator returned null");
        }
        if (!acceptance.isSuccess()) {
            log.warn("Direction '{}' rejected: {}", direction.getId(), acceptance.getOutcome().getMessage());
        }
        return new DirectionalDerivative(direction, acceptance, raw, derived, computations.getFailures());
    }

    /**
     * Gets the step sizes.
     * @return Unmodifiable list of sizes
     */
    public List<Double> getSizes() {
        return sizes;
    }

    /**
     * Gets the method kinds.
     * @return Unmodifiable set of kinds in request order
     */
    public Set<MethodKind> getMethods() {
        return methods;
    }

    /**
     * Gets the analyses.
     * @return Unmodifiable list in application order
     */
    public List<Analysis> getAnalyses() {
        return analyses;
    }

    /**
     * Gets the success evaluator.
     * @return Success evaluator
     */
    public SuccessEvaluator getSuccessEvaluator() {
        return successEvaluator;
    }

    /**
     * Builder for {@link NumericalDerivative}.
     */
    public static final class Builder {
        private List<Double> sizes;
        private List<MethodKind> methods;
        private List<Direction> directions;
        private final List<Analysis> analyses = new ArrayList<>();
        private SuccessEvaluator successEvaluator = Consistency.defaults();
        private MethodRegistry registry = MethodRegistry.defaults();
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;

        private Builder() {}

        /**
         * Sets the step sizes.
         * @param sizes Positive, distinct step sizes
         * @return This builder
         */
        public Builder sizes(double... sizes) {
            if (sizes == null) {
                throw new ConfigurationException("Sizes cannot be null");
            }
            List<Double> list = new ArrayList<>(sizes.length);
            for (double s : sizes) {
                list.add(s);
            }
            this.sizes = list;
            return this;
        }

        /**
         * Sets the step sizes.
         * @param sizes Positive, distinct step sizes
         * @return This builder
         */
        public Builder sizes(List<Double> sizes) {
            this.sizes = sizes != null ? new ArrayList<>(sizes) : null;
            return this;
        }

        /**
         * Sets the methods. Duplicates are ignored.
         * @param methods Registered method kinds
         * @return This builder
         */
        public Builder methods(MethodKind... methods) {
            this.methods = methods != null ? Arrays.asList(methods) : null;
            return this;
        }

        /**
         * Sets the methods. Duplicates are ignored.
         * @param methods Registered method kinds
         * @return This builder
         */
        public Builder methods(Collection<MethodKind> methods) {
            this.methods = methods != null ? new ArrayList<>(methods) : null;
            return this;
        }

        /**
         * Sets custom directions. Without this the standard basis is used.
         * Dimensions are checked against the point on each request.
         * @param directions Directions with distinct ids
         * @return This builder
         */
        public Builder directions(Direction... directions) {
            if (directions == null) {
                throw new ConfigurationException("Directions cannot be null");
            }
            return directions(Arrays.asList(directions));
        }

        /**
         * Sets custom directions. Without this the standard basis is used.
         * @param directions Directions with distinct ids
         * @return This builder
         */
        public Builder directions(List<Direction> directions) {
            if (directions == null) {
                throw new ConfigurationException("Directions cannot be null");
            }
            this.directions = new ArrayList<>(directions);
            return this;
        }

        /**
         * Appends analyses, applied in the order given.
         * @param analyses Analyses
         * @return This builder
         */
        public Builder analyses(Analysis... analyses) {
            if (analyses == null) {
                throw new ConfigurationException("Analyses cannot be null");
            }
            for (Analysis a : analyses) {
                if (a == null) {
                    throw new ConfigurationException("Analysis cannot be null");
                }
                this.analyses.add(a);
            }
            return this;
        }

        /**
         * Sets the success evaluator.
         * @param evaluator Evaluator (null for {@link Consistency#defaults()})
         * @return This builder
         */
        public Builder successEvaluator(SuccessEvaluator evaluator) {
            this.successEvaluator = evaluator != null ? evaluator : Consistency.defaults();
            return this;
        }

        /**
         * Sets the method registry.
         * @param registry Registry (null for {@link MethodRegistry#defaults()})
         * @return This builder
         */
        public Builder registry(MethodRegistry registry) {
            this.registry = registry != null ? registry : MethodRegistry.defaults();
            return this;
        }

        /**
         * Sets the failure policy.
         * @param policy Policy (null for fail-fast)
         * @return This builder
         */
        public Builder failurePolicy(FailurePolicy policy) {
            this.failurePolicy = policy != null ? policy : FailurePolicy.FAIL_FAST;
            return this;
        }

        /**
         * Builds the differentiator.
         * @return Immutable differentiator
         * @throws ConfigurationException if sizes or methods are missing or invalid
         */
        public NumericalDerivative build() {
            ComputationOrchestrator orchestrator =
                    new ComputationOrchestrator(new DifferenceComputer(registry), failurePolicy);
            List<Double> checkedSizes = ComputationOrchestrator.checkSizes(sizes);
            Set<MethodKind> checkedMethods = orchestrator.checkMethods(methods);
            if (directions != null) {
                // point dimension is checked per request
                Directions.validate(directions);
            }
            return new NumericalDerivative(this, checkedSizes, checkedMethods, orchestrator);
        }
    }
}
