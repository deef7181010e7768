/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the direction × size × method expansion.
 */
public class ComputationOrchestratorTest {

    private static final List<MethodKind> ONE_SIDED = List.of(MethodKind.FORWARD, MethodKind.BACKWARD);

    private static ComputationOrchestrator orchestrator(FailurePolicy policy) {
        return new ComputationOrchestrator(new DifferenceComputer(MethodRegistry.defaults()), policy);
    }

    @Test
    @DisplayName("Every combination is evaluated, direction then size then method")
    void testExpansionOrder() {
        Map<String, List<ComputerResult>> results = orchestrator(FailurePolicy.FAIL_FAST).run(
            VectorFunction.scalar(x -> x[0] * x[1]), new double[]{2.0, 3.0},
            null, List.of(1e-3, 1e-4), ONE_SIDED);

        assertThat(results).containsOnlyKeys("0", "1");
        assertThat(results.keySet()).containsExactly("0", "1");
        for (List<ComputerResult> perDirection : results.values()) {
            assertThat(perDirection).extracting(ComputerResult::getSize)
                .containsExactly(1e-3, 1e-3, 1e-4, 1e-4);
            assertThat(perDirection).extracting(ComputerResult::getMethod)
                .containsExactly(MethodKind.FORWARD, MethodKind.BACKWARD, MethodKind.FORWARD, MethodKind.BACKWARD);
        }
        // d(x0*x1)/dx0 = x1, exact for a function linear in x0
        assertThat(results.get("0").get(0).getValue()[0]).isCloseTo(3.0, within(1e-9));
        assertThat(results.get("1").get(3).getValue()[0]).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("f(x) is evaluated once per request")
    void testBaseValueShared() {
        AtomicInteger calls = new AtomicInteger();
        VectorFunction counting = x -> {
            calls.incrementAndGet();
            return new double[]{x[0] + x[1] + x[2]};
        };

        orchestrator(FailurePolicy.FAIL_FAST).run(counting, new double[]{1, 2, 3},
            null, List.of(1e-2, 1e-3, 1e-4), ONE_SIDED);

        // 3 directions × 3 sizes × 2 methods, plus one shared f(x)
        assertThat(calls.get()).isEqualTo(3 * 3 * 2 + 1);
    }

    @Test
    @DisplayName("Duplicate methods collapse")
    void testDuplicateMethods() {
        Map<String, List<ComputerResult>> results = orchestrator(FailurePolicy.FAIL_FAST).run(
            VectorFunction.scalar(x -> x[0]), new double[]{1.0}, null, List.of(1e-3),
            List.of(MethodKind.CENTRAL, MethodKind.CENTRAL, MethodKind.of("central")));

        assertThat(results.get("0")).hasSize(1);
    }

    @Test
    @DisplayName("Fail-fast aborts on the first failed evaluation")
    void testFailFast() {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException boom = new IllegalStateException("negative input");
        VectorFunction sqrt = x -> {
            calls.incrementAndGet();
            if (x[0] < 0) {
                throw boom;
            }
            return new double[]{Math.sqrt(x[0])};
        };

        EvaluationException e = catchThrowableOfType(() -> orchestrator(FailurePolicy.FAIL_FAST).run(sqrt,
                new double[]{0.0}, null, List.of(1e-3, 1e-4), ONE_SIDED), EvaluationException.class);

        assertThat(e).hasCause(boom);
        assertThat(e.getKind()).isEqualTo(ErrorKind.EVALUATION);
        assertThat(e.getPoint()).containsExactly(-1e-3);
        // f(x), forward at 1e-3, failing backward at 1e-3
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Partial mode records failures and keeps going")
    void testCollectPartial() {
        VectorFunction guarded = x -> {
            if (x[1] < 0) {
                throw new IllegalArgumentException("x1 must be non-negative");
            }
            return new double[]{3 * x[0] + 2 * x[1]};
        };
        FunctionSampler sampler = new FunctionSampler(guarded, new double[]{1.0, 0.0});
        ComputationOrchestrator orchestrator = orchestrator(FailurePolicy.COLLECT_PARTIAL);

        Map<String, Computations> computed = orchestrator.collect(sampler, Directions.standardBasis(2),
            List.of(1e-3, 1e-4), orchestrator.checkMethods(ONE_SIDED));

        assertThat(computed.get("0").getResults()).hasSize(4);
        assertThat(computed.get("0").getFailures()).isEmpty();
        assertThat(computed.get("1").getResults()).extracting(ComputerResult::getMethod)
            .containsOnly(MethodKind.FORWARD);
        assertThat(computed.get("1").getFailures())
            .extracting(ComputationFailure::getMethod, ComputationFailure::getSize)
            .containsExactly(tuple(MethodKind.BACKWARD, 1e-3), tuple(MethodKind.BACKWARD, 1e-4));
        assertThat(computed.get("1").getFailures().get(0).getCause())
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(sampler.getEvaluations()).isEqualTo(1 + 4 + 4);
    }

    @Test
    @DisplayName("A failed f(x) is evaluated once and fails every one-sided combination")
    void testBaseFailureCached() {
        AtomicInteger calls = new AtomicInteger();
        VectorFunction broken = x -> {
            calls.incrementAndGet();
            throw new UnsupportedOperationException("not today");
        };
        FunctionSampler sampler = new FunctionSampler(broken, new double[]{1.0, 2.0});
        ComputationOrchestrator orchestrator = orchestrator(FailurePolicy.COLLECT_PARTIAL);

        Map<String, Computations> computed = orchestrator.collect(sampler, Directions.standardBasis(2),
            List.of(1e-3), orchestrator.checkMethods(ONE_SIDED));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(computed.values()).allSatisfy(c -> {
            assertThat(c.getResults()).isEmpty();
            assertThat(c.getFailures()).hasSize(2);
        });
    }

    @Test
    @DisplayName("Malformed function values are evaluation errors")
    void testMalformedValues() {
        ComputationOrchestrator o = orchestrator(FailurePolicy.FAIL_FAST);
        List<Double> sizes = List.of(1e-3);
        double[] point = {1.0};

        assertThatThrownBy(() -> o.run(x -> null, point, null, sizes, ONE_SIDED))
            .isInstanceOf(EvaluationException.class).hasMessageContaining("null");
        assertThatThrownBy(() -> o.run(x -> new double[]{Double.NaN}, point, null, sizes, ONE_SIDED))
            .isInstanceOf(EvaluationException.class).hasMessageContaining("non-finite");
        assertThatThrownBy(() -> o.run(x -> new double[0], point, null, sizes, ONE_SIDED))
            .isInstanceOf(EvaluationException.class).hasMessageContaining("empty");
        assertThatThrownBy(() -> o.run(x -> x[0] > 1 ? new double[2] : new double[1], point, null, sizes, ONE_SIDED))
            .isInstanceOf(EvaluationException.class).hasMessageContaining("expected 1");
    }

    @Test
    @DisplayName("Invalid requests are rejected before any evaluation")
    void testConfigurationErrors() {
        AtomicInteger calls = new AtomicInteger();
        VectorFunction counting = x -> {
            calls.incrementAndGet();
            return new double[]{x[0]};
        };
        ComputationOrchestrator o = orchestrator(FailurePolicy.FAIL_FAST);
        double[] point = {1.0, 2.0};

        assertThatThrownBy(() -> o.run(counting, point, null, List.of(), ONE_SIDED))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> o.run(counting, point, null, List.of(1e-3, -1e-3), ONE_SIDED))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> o.run(counting, point, null, List.of(1e-3, 1e-3), ONE_SIDED))
            .isInstanceOf(ConfigurationException.class).hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> o.run(counting, point, null, List.of(1e-3), List.of()))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> o.run(counting, point, null, List.of(1e-3), List.of(MethodKind.of("spline"))))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> o.run(counting, point, List.of(), List.of(1e-3), ONE_SIDED))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> o.run(counting, point, List.of(Direction.unit(0, 3)), List.of(1e-3), ONE_SIDED))
            .isInstanceOf(ConfigurationException.class).hasMessageContaining("dimension");
        assertThatThrownBy(() -> o.run(counting, new double[]{Double.NaN}, null, List.of(1e-3), ONE_SIDED))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> o.run(counting, new double[0], null, List.of(1e-3), ONE_SIDED))
            .isInstanceOf(ConfigurationException.class);
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("Any exception thrown by the function is an evaluation error")
    void testFunctionExceptionsAreEvaluationErrors() {
        VectorFunction picky = x -> {
            if (x[0] > 1) {
                throw new ConfigurationException("x0 out of range");
            }
            return new double[]{2 * x[0]};
        };
        double[] point = {1.0};
        List<Double> sizes = List.of(1e-3);

        EvaluationException thrown = catchThrowableOfType(
            () -> orchestrator(FailurePolicy.FAIL_FAST).run(picky, point, null, sizes, ONE_SIDED),
            EvaluationException.class);
        assertThat(thrown).hasCauseInstanceOf(ConfigurationException.class);
        assertThat(thrown.getKind()).isEqualTo(ErrorKind.EVALUATION);

        FunctionSampler sampler = new FunctionSampler(picky, point);
        ComputationOrchestrator partial = orchestrator(FailurePolicy.COLLECT_PARTIAL);
        Computations c = partial.collect(sampler, Directions.standardBasis(1), sizes,
            partial.checkMethods(ONE_SIDED)).get("0");

        assertThat(c.getResults()).extracting(ComputerResult::getMethod).containsExactly(MethodKind.BACKWARD);
        assertThat(c.getFailures()).extracting(ComputationFailure::getMethod).containsExactly(MethodKind.FORWARD);
        assertThat(c.getFailures().get(0).getCause()).hasCauseInstanceOf(ConfigurationException.class);
    }
}
