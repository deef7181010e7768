/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.List;

/**
 * Derives secondary estimates from the raw estimates of one direction.
 * <p>
 * Implementations must not modify their input and must be stateless, so one
 * instance can serve every direction of every request. Several analyses may
 * be configured; their outputs are concatenated in configuration order.
 * </p>
 *
 * @see ApproximateCentral
 */
public interface Analysis {

    /**
     * Gets the id stamped on every result of this analysis.
     * @return Analysis id
     */
    String id();

    /**
     * Derives estimates for one direction.
     * @param results Raw estimates of the direction, in computation order
     * @return Derived estimates, possibly empty, never null
     */
    List<AnalysisResult> derive(List<ComputerResult> results);
}
