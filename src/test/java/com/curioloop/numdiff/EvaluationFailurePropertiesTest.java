/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for target function failures.
 */
public class EvaluationFailurePropertiesTest {

    /**
     * Custom exception for testing function failure handling.
     */
    public static class TestCallbackException extends RuntimeException {
        private final int evaluationNumber;

        public TestCallbackException(int evaluationNumber) {
            super("Test exception at evaluation " + evaluationNumber);
            this.evaluationNumber = evaluationNumber;
        }

        public int getEvaluationNumber() {
            return evaluationNumber;
        }
    }

    /**
     * For any function that throws at evaluation k+1, a fail-fast request
     * stops right there and surfaces the original exception as the cause.
     */
    @Property(tries = 100)
    @Label("Fail-fast stops at the first failed evaluation")
    void failFastStopsImmediately(
            @ForAll @IntRange(min = 1, max = 5) int n,
            @ForAll @IntRange(min = 0, max = 12) int throwAfterK
    ) {
        AtomicInteger evaluationCount = new AtomicInteger(0);
        VectorFunction throwing = x -> {
            int current = evaluationCount.incrementAndGet();
            if (current > throwAfterK) {
                throw new TestCallbackException(current);
            }
            double f = 0.0;
            for (double v : x) {
                f += v * v;
            }
            return new double[]{f};
        };

        NumericalDerivative nd = NumericalDerivative.builder()
                .sizes(1e-3, 1e-4)
                .methods(MethodKind.FORWARD, MethodKind.BACKWARD)
                .build();
        // f(x) plus 4 evaluations per direction
        int required = 1 + 4 * n;
        Assume.that(throwAfterK < required);

        EvaluationException e = catchThrowableOfType(
                () -> nd.differentiate(throwing, new double[n]), EvaluationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getCause()).isInstanceOf(TestCallbackException.class);
        assertThat(((TestCallbackException) e.getCause()).getEvaluationNumber()).isEqualTo(throwAfterK + 1);
        assertThat(evaluationCount.get()).isEqualTo(throwAfterK + 1);
    }

    /**
     * For any function that fails at some perturbed points, partial mode
     * evaluates every remaining combination and accounts for each one exactly
     * once, as a result or as a failure.
     */
    @Property(tries = 100)
    @Label("Partial mode accounts for every combination")
    void partialModeAccountsForEveryCombination(
            @ForAll @IntRange(min = 1, max = 5) int n,
            @ForAll @IntRange(min = 1, max = 3) int sizes,
            @ForAll @IntRange(min = 2, max = 7) int modulus
    ) {
        AtomicInteger evaluationCount = new AtomicInteger(0);
        VectorFunction flaky = x -> {
            int current = evaluationCount.incrementAndGet();
            // f(x) is the first evaluation and always succeeds
            if (current > 1 && current % modulus == 0) {
                throw new TestCallbackException(current);
            }
            return new double[]{x[0]};
        };
        double[] steps = new double[sizes];
        for (int i = 0; i < sizes; i++) {
            steps[i] = Math.pow(10, -3 - i);
        }

        Derivative d = NumericalDerivative.builder()
                .sizes(steps)
                .methods(MethodKind.FORWARD, MethodKind.BACKWARD, MethodKind.CENTRAL)
                .failurePolicy(FailurePolicy.COLLECT_PARTIAL)
                .build()
                .differentiate(flaky, new double[n]);

        int failures = 0;
        for (DirectionalDerivative dd : d.getDirectionals()) {
            assertThat(dd.getComputerResults().size() + dd.getFailures().size()).isEqualTo(sizes * 3);
            failures += dd.getFailures().size();
            assertThat(dd.getFailures()).allSatisfy(f ->
                    assertThat(f.getCause()).hasCauseInstanceOf(TestCallbackException.class));
        }
        assertThat(d.isComplete()).isEqualTo(failures == 0);
        // central stops at its first failed evaluation, so this is an upper bound
        assertThat(d.getEvaluations()).isEqualTo(evaluationCount.get());
        assertThat(d.getEvaluations()).isLessThanOrEqualTo(1 + n * sizes * 4);
    }
}
