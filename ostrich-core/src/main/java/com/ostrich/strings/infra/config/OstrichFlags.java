/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.infra.config;

import java.util.Objects;

/**
 * Solver toggles read once at theory construction.
 *
 * @param eagerAutomataOperations evaluate automata products eagerly
 * @param useLength               length reasoning mode
 * @param forwardApprox           propagate forward approximations
 */
public record OstrichFlags(boolean eagerAutomataOperations, LengthMode useLength, boolean forwardApprox) {

    public static final OstrichFlags DEFAULT = new OstrichFlags(false, LengthMode.AUTO, false);

    public OstrichFlags {
        Objects.requireNonNull(useLength, "useLength must not be null");
    }

    /**
     * @return whether length atoms are decided completely ({@code ON} or {@code AUTO})
     */
    public boolean lengthReasoningEnabled() {
        return useLength != LengthMode.OFF;
    }
}
