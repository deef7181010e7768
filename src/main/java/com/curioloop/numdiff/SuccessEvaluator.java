/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.List;

/**
 * Decides whether the estimates of one direction are trustworthy and which
 * value to accept.
 * <p>
 * A failed check is a normal result, reported through {@link Acceptance};
 * implementations must not throw for inconsistent estimates. Implementations
 * must be stateless and must only look at the estimates they are given.
 * </p>
 *
 * @see Consistency
 */
@FunctionalInterface
public interface SuccessEvaluator {

    /**
     * Evaluates the pooled raw and derived estimates of one direction.
     * @param direction Direction being evaluated
     * @param estimates Raw estimates followed by derived ones
     * @return Acceptance, never null
     */
    Acceptance evaluate(Direction direction, List<Estimate> estimates);
}
