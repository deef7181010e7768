/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.numdiff;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup table from {@link MethodKind} to {@link Stencil}.
 * <p>
 * New methods are added by registering a stencil; no other layer changes.
 * Instances are read-only and safe to share between threads and requests.
 * </p>
 *
 * <pre>{@code
 * MethodKind threePoint = MethodKind.of("three_point");
 * MethodRegistry registry = MethodRegistry.builder()
 *     .registerDefaults()
 *     .register(threePoint, (probe, h) -> ...)
 *     .build();
 * }</pre>
 */
public final class MethodRegistry {

    private static final MethodRegistry DEFAULTS = builder().registerDefaults().build();

    private final Map<MethodKind, Stencil> stencils;

    private MethodRegistry(Map<MethodKind, Stencil> stencils) {
        this.stencils = Collections.unmodifiableMap(new LinkedHashMap<>(stencils));
    }

    /**
     * Gets the registry of all {@link FiniteDifference} stencils.
     * @return Shared default registry
     */
    public static MethodRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new, empty registry builder.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the stencil for a method.
     * @param kind Method kind
     * @return Registered stencil
     * @throws ConfigurationException if the kind is not registered
     */
    public Stencil stencil(MethodKind kind) {
        Stencil stencil = kind != null ? stencils.get(kind) : null;
        if (stencil == null) {
            throw new ConfigurationException("Unregistered method kind '" + kind
                    + "', registered: " + stencils.keySet());
        }
        return stencil;
    }

    /**
     * Checks that every requested kind is registered.
     * @param kinds Requested kinds
     * @throws ConfigurationException on the first unregistered kind
     */
    public void validate(Collection<MethodKind> kinds) {
        for (MethodKind kind : kinds) {
            stencil(kind);
        }
    }

    /**
     * Checks if a kind is registered.
     * @param kind Method kind
     * @return true if registered
     */
    public boolean contains(MethodKind kind) {
        return stencils.containsKey(kind);
    }

    /**
     * Gets the registered kinds in registration order.
     * @return Unmodifiable set of kinds
     */
    public Set<MethodKind> kinds() {
        return stencils.keySet();
    }

    /**
     * Builder for method registries.
     */
    public static final class Builder {
        private final Map<MethodKind, Stencil> stencils = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers every {@link FiniteDifference} under its own kind.
         * @return This builder
         */
        public Builder registerDefaults() {
            for (FiniteDifference fd : FiniteDifference.values()) {
                register(fd);
            }
            return this;
        }

        /**
         * Registers a built-in stencil under its own kind.
         * @param stencil Built-in stencil
         * @return This builder
         */
        public Builder register(FiniteDifference stencil) {
            return register(stencil.kind(), stencil);
        }

        /**
         * Registers a stencil.
         * @param kind Method kind
         * @param stencil Stencil
         * @return This builder
         * @throws ConfigurationException if the kind is already registered
         */
        public Builder register(MethodKind kind, Stencil stencil) {
            if (kind == null || stencil == null) {
                throw new ConfigurationException("Method kind and stencil are required");
            }
            if (stencils.putIfAbsent(kind, stencil) != null) {
                throw new ConfigurationException("Method kind '" + kind + "' is already registered");
            }
            return this;
        }

        /**
         * Builds the registry.
         * @return Immutable registry
         */
        public MethodRegistry build() {
            return new MethodRegistry(stencils);
        }
    }
}
