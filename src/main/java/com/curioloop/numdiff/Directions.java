/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the directions of a derivative request.
 */
final class Directions {

    private Directions() {}

    /**
     * Builds the standard basis e_0 .. e_{n-1}.
     * @param n Dimension
     * @return Basis directions with ids "0" .. "n-1"
     */
    static List<Direction> standardBasis(int n) {
        List<Direction> basis = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            basis.add(Direction.unit(i, n));
        }
        return Collections.unmodifiableList(basis);
    }

    /**
     * Resolves the directions for a point: the caller's when given,
     * otherwise the standard basis.
     * @param requested Caller-supplied directions (null for default)
     * @param n Point dimension
     * @return Validated directions
     * @throws ConfigurationException on invalid directions or dimension mismatch
     */
    static List<Direction> resolve(List<Direction> requested, int n) {
        if (requested == null) {
            return standardBasis(n);
        }
        validate(requested);
        for (Direction d : requested) {
            if (d.getDimension() != n) {
                throw new ConfigurationException("Direction '" + d.getId() + "' has dimension "
                        + d.getDimension() + " but point has dimension " + n);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(requested));
    }

    /**
     * Checks what can be checked without a point: non-empty, no nulls,
     * distinct ids, one common dimension.
     * @param requested Caller-supplied directions
     * @throws ConfigurationException on the first violation
     */
    static void validate(List<Direction> requested) {
        if (requested.isEmpty()) {
            throw new ConfigurationException("At least one direction is required");
        }
        Set<String> ids = new HashSet<>();
        int dimension = -1;
        for (Direction d : requested) {
            if (d == null) {
                throw new ConfigurationException("Direction cannot be null");
            }
            if (!ids.add(d.getId())) {
                throw new ConfigurationException("Duplicate direction id '" + d.getId() + "'");
            }
            if (dimension >= 0 && d.getDimension() != dimension) {
                throw new ConfigurationException("Directions have different dimensions");
            }
            dimension = d.getDimension();
        }
    }
}
