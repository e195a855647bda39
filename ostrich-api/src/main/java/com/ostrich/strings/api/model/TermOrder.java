/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The host's ordering of the variables that exist in the current proof state.
 */
public final class TermOrder {

    public static final TermOrder EMPTY = new TermOrder(List.of());

    private final List<ConstantTerm> orderedConstants;
    private final Set<ConstantTerm> constantSet;

    private TermOrder(Collection<ConstantTerm> constants) {
        this.constantSet = Collections.unmodifiableSet(new LinkedHashSet<>(constants));
        this.orderedConstants = List.copyOf(constantSet);
    }

    public static TermOrder of(Collection<ConstantTerm> constants) {
        return new TermOrder(constants);
    }

    public static TermOrder of(ConstantTerm... constants) {
        return new TermOrder(List.of(constants));
    }

    public List<ConstantTerm> orderedConstants() {
        return orderedConstants;
    }

    public boolean contains(ConstantTerm constant) {
        return constantSet.contains(constant);
    }

    /**
     * @return whether every variable of {@code term} is known to this order
     */
    public boolean covers(Term term) {
        return constantSet.containsAll(term.constants());
    }

    public TermOrder extend(ConstantTerm constant) {
        LinkedHashSet<ConstantTerm> extended = new LinkedHashSet<>(orderedConstants);
        extended.add(constant);
        return new TermOrder(extended);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TermOrder other && orderedConstants.equals(other.orderedConstants));
    }

    @Override
    public int hashCode() {
        return orderedConstants.hashCode();
    }

    @Override
    public String toString() {
        return orderedConstants.toString();
    }
}
