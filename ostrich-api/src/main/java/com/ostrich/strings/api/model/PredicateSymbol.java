/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A predicate symbol over a fixed argument signature.
 *
 * <p>Functions are handed to the host in relational form: a function
 * {@code f : s1 .. sn -> s} is represented by a predicate {@code f} of arity
 * {@code n + 1} whose last argument is the result.
 */
public record PredicateSymbol(String name, List<Sort> argumentSorts) {

    public PredicateSymbol {
        Objects.requireNonNull(name, "name must not be null");
        argumentSorts = List.copyOf(argumentSorts);
    }

    public int arity() {
        return argumentSorts.size();
    }

    @Override
    public String toString() {
        return name + "/" + arity();
    }
}
