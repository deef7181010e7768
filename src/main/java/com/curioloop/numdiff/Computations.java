/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw estimates and failures collected for one direction.
 * Append-only while the orchestrator runs, frozen afterwards.
 */
public final class Computations {

    private final Direction direction;
    private final List<ComputerResult> results = new ArrayList<>();
    private final List<ComputationFailure> failures = new ArrayList<>();
    private boolean frozen;

    Computations(Direction direction) {
        this.direction = direction;
    }

    void add(ComputerResult result) {
        checkOpen();
        results.add(result);
    }

    void fail(ComputationFailure failure) {
        checkOpen();
        failures.add(failure);
    }

    Computations freeze() {
        frozen = true;
        return this;
    }

    private void checkOpen() {
        if (frozen) {
            throw new IllegalStateException("Computations for '" + direction.getId() + "' are frozen");
        }
    }

    /**
     * Gets the direction.
     * @return Direction
     */
    public Direction getDirection() {
        return direction;
    }

    /**
     * Gets the raw estimates in size-then-method order.
     * @return Unmodifiable list
     */
    public List<ComputerResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    /**
     * Gets the combinations that failed.
     * @return Unmodifiable list, empty under fail-fast
     */
    public List<ComputationFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}
