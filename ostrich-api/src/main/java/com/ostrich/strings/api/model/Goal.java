/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Objects;

/**
 * A host proof state presented to the string theory.
 */
public record Goal(ConstraintSet facts, TermOrder order, GoalState state) {

    public Goal {
        Objects.requireNonNull(facts, "facts must not be null");
        Objects.requireNonNull(order, "order must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    public static Goal finalGoal(ConstraintSet facts, TermOrder order) {
        return new Goal(facts, order, GoalState.FINAL);
    }
}
