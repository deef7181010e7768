/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.Arrays;

/**
 * Result of evaluating the estimates of one direction: an outcome and,
 * on success only, the accepted value.
 */
public final class Acceptance {

    private final Outcome outcome;
    private final double[] value;

    private Acceptance(Outcome outcome, double[] value) {
        this.outcome = outcome;
        this.value = value;
    }

    /**
     * Creates a successful acceptance.
     * @param value Accepted value
     * @return Acceptance
     */
    public static Acceptance accepted(double[] value) {
        if (value == null) {
            throw new IllegalArgumentException("Accepted value cannot be null");
        }
        return new Acceptance(Outcome.ACCEPTED, value.clone());
    }

    /**
     * Creates a rejection.
     * @param outcome Failed outcome
     * @return Acceptance without value
     */
    public static Acceptance rejected(Outcome outcome) {
        if (outcome == null || outcome.isSuccess()) {
            throw new IllegalArgumentException("Rejection requires a failed outcome");
        }
        return new Acceptance(outcome, null);
    }

    /**
     * Gets the outcome.
     * @return Outcome
     */
    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * Checks if a value was accepted.
     * @return true on success
     */
    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    /**
     * Gets the accepted value.
     * @return Copy of the value, or null if rejected
     */
    public double[] getValue() {
        return value != null ? value.clone() : null;
    }

    @Override
    public String toString() {
        return "Acceptance{" +
                "outcome=" + outcome +
                ", value=" + Arrays.toString(value) +
                '}';
    }
}
