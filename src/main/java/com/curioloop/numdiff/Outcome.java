/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * Verdict of a {@link SuccessEvaluator} for one direction.
 */
public enum Outcome {

    /** Estimates agree; a value was accepted */
    ACCEPTED(0, "Estimates are consistent"),

    /** Nothing to evaluate, e.g. every combination failed in partial mode */
    NO_ESTIMATES(-1, "No estimates available"),

    /** Every group of estimates disagrees internally */
    NO_CONSISTENT_GROUP(-2, "No internally consistent group"),

    /** Consistent groups disagree with each other */
    GROUPS_DISAGREE(-3, "Consistent groups disagree");

    private final int code;
    private final String message;

    Outcome(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Gets the numeric outcome code.
     * @return Outcome code
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets the outcome message.
     * @return Outcome message
     */
    public String getMessage() {
        return message;
    }

    /**
     * Checks if this outcome accepted a value.
     * @return true if accepted
     */
    public boolean isSuccess() {
        return code == 0;
    }

    @Override
    public String toString() {
        return name() + "(" + code + "): " + message;
    }
}
