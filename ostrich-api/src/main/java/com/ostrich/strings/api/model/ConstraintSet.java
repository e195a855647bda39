/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the conjunction of facts the host currently considers.
 *
 * <p>Equality and hash code ignore the order in which facts were added, so two
 * snapshots of the same proof state are interchangeable as cache keys.
 */
public final class ConstraintSet {

    public static final ConstraintSet EMPTY = new ConstraintSet(List.of(), List.of());

    private final List<Atom> atoms;
    private final List<Equality> equalities;
    private final Set<Atom> atomSet;
    private final Set<Equality> equalitySet;
    private final Set<PredicateSymbol> predicates;
    private final int hashCode;

    private ConstraintSet(Collection<Atom> atoms, Collection<Equality> equalities) {
        this.atomSet = Collections.unmodifiableSet(new LinkedHashSet<>(atoms));
        this.equalitySet = Collections.unmodifiableSet(new LinkedHashSet<>(equalities));
        this.atoms = List.copyOf(atomSet);
        this.equalities = List.copyOf(equalitySet);

        Set<PredicateSymbol> preds = new LinkedHashSet<>();
        for (Atom atom : this.atoms) {
            preds.add(atom.predicate());
        }
        this.predicates = Collections.unmodifiableSet(preds);
        this.hashCode = 31 * atomSet.hashCode() + equalitySet.hashCode();
    }

    public static ConstraintSet of(Collection<Atom> atoms, Collection<Equality> equalities) {
        return new ConstraintSet(atoms, equalities);
    }

    public static ConstraintSet of(Atom... atoms) {
        return new ConstraintSet(List.of(atoms), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Atom> atoms() {
        return atoms;
    }

    public List<Equality> equalities() {
        return equalities;
    }

    /**
     * @return the predicates occurring in the atoms of this set
     */
    public Set<PredicateSymbol> predicates() {
        return predicates;
    }

    public List<Atom> atomsFor(PredicateSymbol predicate) {
        List<Atom> result = new ArrayList<>();
        for (Atom atom : atoms) {
            if (atom.predicate().equals(predicate)) {
                result.add(atom);
            }
        }
        return result;
    }

    public boolean contains(Atom atom) {
        return atomSet.contains(atom);
    }

    public boolean isEmpty() {
        return atoms.isEmpty() && equalities.isEmpty();
    }

    public int size() {
        return atoms.size() + equalities.size();
    }

    /**
     * Returns a snapshot with {@code removed} atoms dropped and the given facts added.
     */
    public ConstraintSet update(Collection<Atom> removed, Collection<Atom> addedAtoms,
                                Collection<Equality> addedEqualities) {
        Set<Atom> newAtoms = new LinkedHashSet<>(atoms);
        newAtoms.removeAll(removed);
        newAtoms.addAll(addedAtoms);
        Set<Equality> newEqualities = new LinkedHashSet<>(equalities);
        newEqualities.addAll(addedEqualities);
        return new ConstraintSet(newAtoms, newEqualities);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConstraintSet other)) {
            return false;
        }
        return hashCode == other.hashCode
                && atomSet.equals(other.atomSet)
                && equalitySet.equals(other.equalitySet);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>(size());
        atoms.forEach(a -> parts.add(a.toString()));
        equalities.forEach(e -> parts.add(e.toString()));
        return "{" + String.join(" & ", parts) + "}";
    }

    /**
     * Incremental construction of a snapshot.
     */
    public static final class Builder {
        private final List<Atom> atoms = new ArrayList<>();
        private final List<Equality> equalities = new ArrayList<>();

        private Builder() {
        }

        public Builder atom(PredicateSymbol predicate, Term... arguments) {
            atoms.add(Atom.of(predicate, arguments));
            return this;
        }

        public Builder atom(Atom atom) {
            atoms.add(Objects.requireNonNull(atom, "atom must not be null"));
            return this;
        }

        public Builder equality(Term left, Term right) {
            equalities.add(Equality.of(left, right));
            return this;
        }

        public Builder equality(Term left, long value) {
            equalities.add(Equality.of(left, value));
            return this;
        }

        public ConstraintSet build() {
            return new ConstraintSet(atoms, equalities);
        }
    }
}
