/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A function symbol {@code name : argumentSorts -> resultSort}.
 *
 * @param partial whether the function may be undefined for some arguments
 */
public record FunctionSymbol(
        String name,
        List<Sort> argumentSorts,
        Sort resultSort,
        boolean partial
) {
    public FunctionSymbol {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(resultSort, "resultSort must not be null");
        argumentSorts = List.copyOf(argumentSorts);
    }

    public static FunctionSymbol of(String name, List<Sort> argumentSorts, Sort resultSort) {
        return new FunctionSymbol(name, argumentSorts, resultSort, false);
    }

    public int arity() {
        return argumentSorts.size();
    }

    @Override
    public String toString() {
        return name + "/" + arity();
    }
}
