/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

/**
 * What the orchestrator does when a function evaluation fails.
 */
public enum FailurePolicy {

    /** Abort the whole request with the first {@link EvaluationException} */
    FAIL_FAST,

    /**
     * Record a {@link ComputationFailure} for the combination and keep going.
     * Directions with failures are reported as incomplete.
     */
    COLLECT_PARTIAL
}
