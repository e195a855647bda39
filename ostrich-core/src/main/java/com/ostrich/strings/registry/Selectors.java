/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.registry;

import com.ostrich.strings.api.model.Atom;
import com.ostrich.strings.api.model.Term;

import java.util.List;
import java.util.function.Function;

/**
 * Standard argument and result selectors for registry entries.
 */
public final class Selectors {

    private Selectors() {
    }

    /** Relational form of a function: every argument but the last. */
    public static Function<Atom, List<Term>> functionArguments() {
        return a -> a.arguments().subList(0, a.arity() - 1);
    }

    /** Relational form of a function: the last argument. */
    public static Function<Atom, Term> functionResult() {
        return a -> a.get(a.arity() - 1);
    }

    public static Function<Atom, List<Term>> argument(int index) {
        return a -> List.of(a.get(index));
    }

    public static Function<Atom, Term> result(int index) {
        return a -> a.get(index);
    }

    public static Function<Atom, List<Term>> allArguments() {
        return Atom::arguments;
    }
}
