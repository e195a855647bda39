/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import com.ostrich.strings.api.PreOp;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Registry entry binding a predicate to the PreOp implementing it, together with
 * selectors that pick the constrained argument terms and the result term out of
 * an atom of that predicate.
 */
public record OperatorEntry(
        PredicateSymbol predicate,
        SymbolCategory category,
        PreOp operation,
        Function<Atom, List<Term>> argumentSelector,
        Function<Atom, Term> resultSelector
) {
    public OperatorEntry {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(argumentSelector, "argumentSelector must not be null");
        Objects.requireNonNull(resultSelector, "resultSelector must not be null");
    }

    public List<Term> arguments(Atom atom) {
        checkPredicate(atom);
        return argumentSelector.apply(atom);
    }

    public Term result(Atom atom) {
        checkPredicate(atom);
        return resultSelector.apply(atom);
    }

    private void checkPredicate(Atom atom) {
        if (!atom.predicate().equals(predicate)) {
            throw new IllegalArgumentException(
                    "Atom " + atom + " does not belong to operator " + predicate);
        }
    }
}
