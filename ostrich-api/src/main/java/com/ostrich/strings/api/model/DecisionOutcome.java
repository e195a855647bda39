/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one string model search: a model, or the verdict that none exists.
 */
public final class DecisionOutcome {

    private static final DecisionOutcome NO_MODEL = new DecisionOutcome(null);

    private final StringModel model;

    private DecisionOutcome(StringModel model) {
        this.model = model;
    }

    public static DecisionOutcome sat(StringModel model) {
        return new DecisionOutcome(Objects.requireNonNull(model, "model must not be null"));
    }

    public static DecisionOutcome noModel() {
        return NO_MODEL;
    }

    public boolean hasModel() {
        return model != null;
    }

    public Optional<StringModel> model() {
        return Optional.ofNullable(model);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DecisionOutcome other && Objects.equals(model, other.model));
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(model);
    }

    @Override
    public String toString() {
        return hasModel() ? "SAT(" + model + ")" : "NO_MODEL";
    }
}
