/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.Objects;

/**
 * Identifies a finite-difference method.
 * <p>
 * Kinds are resolved to a {@link Stencil} through a {@link MethodRegistry}.
 * Two kinds are equal when their ids are equal, so a custom kind created
 * with {@link #of(String)} can be registered and requested from separate
 * places.
 * </p>
 */
public final class MethodKind {

    /** (f(x + h*d) - f(x)) / h */
    public static final MethodKind FORWARD = new MethodKind("forward");

    /** (f(x) - f(x - h*d)) / h */
    public static final MethodKind BACKWARD = new MethodKind("backward");

    /** (f(x + h*d) - f(x - h*d)) / (2*h) */
    public static final MethodKind CENTRAL = new MethodKind("central");

    /** (-f(x+2h*d) + 8f(x+h*d) - 8f(x-h*d) + f(x-2h*d)) / (12*h) */
    public static final MethodKind FIVE_POINT = new MethodKind("five_point");

    private final String id;

    private MethodKind(String id) {
        this.id = id;
    }

    /**
     * Creates a method kind with the given id.
     * @param id Method id (non-blank)
     * @return Method kind
     */
    public static MethodKind of(String id) {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Method id cannot be blank");
        }
        return new MethodKind(id);
    }

    /**
     * Gets the method id.
     * @return Id
     */
    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MethodKind)) return false;
        return id.equals(((MethodKind) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
