/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Application of a function symbol to argument terms, e.g. a string literal
 * {@code str.cons(97, str.empty)}.
 */
public record FunctionTerm(FunctionSymbol function, List<Term> arguments) implements Term {

    public FunctionTerm {
        Objects.requireNonNull(function, "function must not be null");
        arguments = List.copyOf(arguments);
        if (arguments.size() != function.arity()) {
            throw new IllegalArgumentException(
                    "Function " + function + " expects " + function.arity()
                            + " arguments, got " + arguments.size());
        }
    }

    @Override
    public Set<ConstantTerm> constants() {
        Set<ConstantTerm> result = new LinkedHashSet<>();
        for (Term argument : arguments) {
            result.addAll(argument.constants());
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return function.name();
        }
        StringBuilder sb = new StringBuilder(function.name()).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
