/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A predicate applied to argument terms, e.g. {@code str.++(x, y, z)} encoding
 * {@code z = x ++ y}.
 */
public record Atom(PredicateSymbol predicate, List<Term> arguments) {

    public Atom {
        Objects.requireNonNull(predicate, "predicate must not be null");
        arguments = List.copyOf(arguments);
        if (arguments.size() != predicate.arity()) {
            throw new IllegalArgumentException(
                    "Predicate " + predicate + " expects " + predicate.arity()
                            + " arguments, got " + arguments.size());
        }
    }

    public static Atom of(PredicateSymbol predicate, Term... arguments) {
        return new Atom(predicate, List.of(arguments));
    }

    public Term get(int index) {
        return arguments.get(index);
    }

    public int arity() {
        return arguments.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(predicate.name()).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
