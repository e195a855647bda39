/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A proof action returned to the host.
 *
 * <ul>
 *   <li>{@link Kind#ADD_FACTS}: assert the given atoms and equalities</li>
 *   <li>{@link Kind#REMOVE_FACTS}: drop the given atoms from the goal</li>
 *   <li>{@link Kind#CONTRADICTION}: the goal is closed, the host must backtrack</li>
 * </ul>
 */
public record Action(Kind kind, List<Atom> atoms, List<Equality> equalities) {

    public enum Kind {
        ADD_FACTS,
        REMOVE_FACTS,
        CONTRADICTION
    }

    private static final Action CONTRADICTION = new Action(Kind.CONTRADICTION, List.of(), List.of());

    public Action {
        Objects.requireNonNull(kind, "kind must not be null");
        atoms = List.copyOf(atoms);
        equalities = List.copyOf(equalities);
    }

    public static Action contradiction() {
        return CONTRADICTION;
    }

    public static Action addFacts(List<Atom> atoms, List<Equality> equalities) {
        return new Action(Kind.ADD_FACTS, atoms, equalities);
    }

    public static Action removeFacts(List<Atom> atoms) {
        return new Action(Kind.REMOVE_FACTS, atoms, List.of());
    }

    public boolean isContradiction() {
        return kind == Kind.CONTRADICTION;
    }
}
