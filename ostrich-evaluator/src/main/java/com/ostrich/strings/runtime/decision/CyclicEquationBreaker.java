/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.runtime.decision;

import com.ostrich.strings.api.model.Action;
import com.ostrich.strings.api.model.Atom;
import com.ostrich.strings.api.model.ConstraintSet;
import com.ostrich.strings.api.model.Equality;
import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.api.model.Term;
import com.ostrich.strings.catalogue.SymbolCatalogue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites cyclic word equations before they reach the model search.
 *
 * <p>Every concatenation atom {@code str.++(l, r, res)} contributes the edges
 * {@code res -> l} and {@code res -> r}. Along a cycle
 * {@code x1 -> x2 -> ... -> x1} the lengths of the {@code xi} can only agree if
 * each concatenation argument that is not the cycle successor is empty, which in
 * turn makes all {@code xi} equal. The cyclic atoms are therefore replaced by
 * emptiness atoms for those arguments and by equalities along the cycle.
 *
 * <p>One cycle is broken per call. The host presents the rewritten goal again,
 * so remaining cycles are broken on later visits.
 */
public final class CyclicEquationBreaker {
    private static final Logger logger = Logger.getLogger(CyclicEquationBreaker.class.getName());

    private final PredicateSymbol concatPredicate;
    private final PredicateSymbol emptyPredicate;

    public CyclicEquationBreaker(SymbolCatalogue catalogue) {
        this(catalogue.concatPredicate(), catalogue.emptyPredicate());
    }

    public CyclicEquationBreaker(PredicateSymbol concatPredicate, PredicateSymbol emptyPredicate) {
        this.concatPredicate = Objects.requireNonNull(concatPredicate, "concatPredicate must not be null");
        this.emptyPredicate = Objects.requireNonNull(emptyPredicate, "emptyPredicate must not be null");
        if (concatPredicate.arity() != 3 || emptyPredicate.arity() != 1) {
            throw new IllegalArgumentException(
                    "Expected concatenation of arity 3 and emptiness of arity 1, got "
                            + concatPredicate + " and " + emptyPredicate);
        }
    }

    /**
     * One edge of the concatenation graph.
     *
     * @param atom   the concatenation atom the edge stems from
     * @param target the argument the edge leads to
     * @param other  the remaining argument of the same atom
     */
    private record Edge(Atom atom, Term target, Term other) {
    }

    /**
     * @return corrective actions for the first cycle found, or empty if the
     *         concatenation atoms of {@code facts} are acyclic
     */
    public Optional<List<Action>> breakCycles(ConstraintSet facts) {
        List<Atom> concatenations = facts.atomsFor(concatPredicate);
        if (concatenations.isEmpty()) {
            return Optional.empty();
        }

        Map<Term, List<Edge>> graph = new LinkedHashMap<>();
        for (Atom atom : concatenations) {
            Term left = atom.get(0);
            Term right = atom.get(1);
            Term result = atom.get(2);
            List<Edge> edges = graph.computeIfAbsent(result, k -> new ArrayList<>());
            edges.add(new Edge(atom, left, right));
            edges.add(new Edge(atom, right, left));
        }

        List<Edge> cycle = findCycle(graph);
        if (cycle.isEmpty()) {
            return Optional.empty();
        }

        Set<Atom> cyclicAtoms = new LinkedHashSet<>();
        Set<Atom> emptinessAtoms = new LinkedHashSet<>();
        Set<Equality> equalities = new LinkedHashSet<>();
        for (int i = 0; i < cycle.size(); i++) {
            Edge edge = cycle.get(i);
            cyclicAtoms.add(edge.atom());
            emptinessAtoms.add(Atom.of(emptyPredicate, edge.other()));
            // The closing edge's equality follows from the others
            if (i < cycle.size() - 1) {
                equalities.add(Equality.of(edge.atom().get(2), edge.target()));
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Breaking cyclic word equations " + cyclicAtoms);
        }

        return Optional.of(List.of(
                Action.removeFacts(new ArrayList<>(cyclicAtoms)),
                Action.addFacts(new ArrayList<>(emptinessAtoms), new ArrayList<>(equalities))));
    }

    private List<Edge> findCycle(Map<Term, List<Edge>> graph) {
        Set<Term> finished = new HashSet<>();
        for (Term start : graph.keySet()) {
            if (!finished.contains(start)) {
                List<Edge> cycle = search(start, graph, new HashMap<>(), new ArrayList<>(), finished);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    /**
     * Depth-first search. {@code onPath} maps each term on the current path to the
     * index of its outgoing edge in {@code path}.
     */
    private List<Edge> search(Term node, Map<Term, List<Edge>> graph, Map<Term, Integer> onPath,
                              List<Edge> path, Set<Term> finished) {
        onPath.put(node, path.size());
        for (Edge edge : graph.getOrDefault(node, List.of())) {
            Integer cycleStart = onPath.get(edge.target());
            if (cycleStart != null) {
                List<Edge> cycle = new ArrayList<>(path.subList(cycleStart, path.size()));
                cycle.add(edge);
                return cycle;
            }
            if (finished.contains(edge.target())) {
                continue;
            }
            path.add(edge);
            List<Edge> cycle = search(edge.target(), graph, onPath, path, finished);
            if (!cycle.isEmpty()) {
                return cycle;
            }
            path.remove(path.size() - 1);
        }
        onPath.remove(node);
        finished.add(node);
        return List.of();
    }
}
