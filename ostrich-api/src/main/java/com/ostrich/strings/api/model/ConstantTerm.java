/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Objects;
import java.util.Set;

/**
 * A solver-level variable.
 */
public record ConstantTerm(String name, Sort sort) implements Term {

    public ConstantTerm {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sort, "sort must not be null");
    }

    public static ConstantTerm string(String name) {
        return new ConstantTerm(name, Sort.STRING);
    }

    public static ConstantTerm integer(String name) {
        return new ConstantTerm(name, Sort.INTEGER);
    }

    @Override
    public Set<ConstantTerm> constants() {
        return Set.of(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
